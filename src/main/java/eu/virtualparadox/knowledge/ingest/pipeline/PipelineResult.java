package eu.virtualparadox.knowledge.ingest.pipeline;

import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.Embedding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the pipeline computed for one job, ready for WRITING.
 * {@code embeddings.get(i)} belongs to {@code chunks.get(i)}.
 */
public record PipelineResult(List<Chunk> chunks,
                             List<Concept> concepts,
                             List<Embedding> embeddings,
                             String embeddingModelVersion,
                             List<StageProvenance> provenance) {

    /**
     * Concepts grouped by chunk id, in chunk order.
     */
    public Map<String, List<Concept>> conceptsByChunk() {
        final Map<String, List<Concept>> grouped = new LinkedHashMap<>();
        for (final Chunk chunk : chunks) {
            grouped.put(chunk.id(), new ArrayList<>());
        }
        for (final Concept concept : concepts) {
            grouped.computeIfAbsent(concept.chunkId(), id -> new ArrayList<>()).add(concept);
        }
        return grouped;
    }
}
