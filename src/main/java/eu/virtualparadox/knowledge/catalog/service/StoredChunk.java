package eu.virtualparadox.knowledge.catalog.service;

import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.Embedding;

import java.util.List;

/**
 * A chunk as held by the {@link DocumentStore}, together with the artifacts computed for it.
 *
 * @param chunk     the chunk itself
 * @param embedding its embedding, {@code null} if none was computed
 * @param concepts  concepts extracted from it, possibly empty
 * @param indexed   whether the vector and graph writes for its job completed
 */
public record StoredChunk(Chunk chunk, Embedding embedding, List<Concept> concepts, boolean indexed) {

    public StoredChunk {
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
    }
}
