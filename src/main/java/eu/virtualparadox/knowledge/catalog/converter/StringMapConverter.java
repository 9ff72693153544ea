package eu.virtualparadox.knowledge.catalog.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class StringMapConverter extends JsonColumnConverter<Map<String, String>> {

    public StringMapConverter() {
        super(new TypeReference<>() { });
    }
}
