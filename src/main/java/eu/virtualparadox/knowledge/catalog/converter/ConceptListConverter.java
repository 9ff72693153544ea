package eu.virtualparadox.knowledge.catalog.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ConceptListConverter extends JsonColumnConverter<List<Concept>> {

    public ConceptListConverter() {
        super(new TypeReference<>() { });
    }
}
