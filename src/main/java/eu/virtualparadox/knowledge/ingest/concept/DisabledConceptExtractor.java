package eu.virtualparadox.knowledge.ingest.concept;

import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;

import java.util.ArrayList;
import java.util.List;

/**
 * Extractor used when concepts are switched off: always yields nothing.
 */
public final class DisabledConceptExtractor implements ConceptExtractor {

    public static final DisabledConceptExtractor INSTANCE = new DisabledConceptExtractor();

    private DisabledConceptExtractor() {
    }

    @Override
    public List<Concept> extract(final Chunk chunk) {
        return new ArrayList<>();
    }

    @Override
    public List<Concept> process(final List<Chunk> chunks) {
        return new ArrayList<>();
    }
}
