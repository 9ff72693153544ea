package eu.virtualparadox.knowledge.catalog.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class IntegerListConverter extends JsonColumnConverter<List<Integer>> {

    public IntegerListConverter() {
        super(new TypeReference<>() { });
    }
}
