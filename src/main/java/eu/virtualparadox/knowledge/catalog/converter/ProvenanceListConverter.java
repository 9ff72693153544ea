package eu.virtualparadox.knowledge.catalog.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import eu.virtualparadox.knowledge.ingest.pipeline.StageProvenance;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ProvenanceListConverter extends JsonColumnConverter<List<StageProvenance>> {

    public ProvenanceListConverter() {
        super(new TypeReference<>() { });
    }
}
