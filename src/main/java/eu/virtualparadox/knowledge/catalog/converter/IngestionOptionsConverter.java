package eu.virtualparadox.knowledge.catalog.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;
import jakarta.persistence.Converter;

@Converter
public class IngestionOptionsConverter extends JsonColumnConverter<IngestionOptions> {

    public IngestionOptionsConverter() {
        super(new TypeReference<>() { });
    }
}
