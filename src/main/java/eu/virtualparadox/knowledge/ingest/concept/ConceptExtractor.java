package eu.virtualparadox.knowledge.ingest.concept;

import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.pipeline.Processor;

import java.util.List;

/**
 * Derives entity and relation concepts from chunks.
 * <p>
 * The pipeline only knows this contract; whether extraction really happens is decided once,
 * when the pipeline for a job is assembled.
 * </p>
 */
public interface ConceptExtractor extends Processor<List<Chunk>, List<Concept>> {

    String STAGE_NAME = "extract_concepts";

    /**
     * Concepts of a single chunk, possibly none.
     */
    List<Concept> extract(Chunk chunk);

    @Override
    default String name() {
        return STAGE_NAME;
    }
}
