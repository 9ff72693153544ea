package eu.virtualparadox.knowledge.ingest.chunker;

import eu.virtualparadox.knowledge.ingest.cleaner.NormalizedText;

/**
 * Input of {@link SemanticChunker}.
 *
 * @param jobId    owning job, used for deterministic chunk ids
 * @param text     normalized text with its section map
 * @param settings budget and overlap
 */
public record ChunkingRequest(String jobId, NormalizedText text, ChunkingSettings settings) {
}
