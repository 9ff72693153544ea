package eu.virtualparadox.knowledge.rag.index;

/**
 * One nearest-neighbour match, best first.
 */
public record VectorHit(String chunkId, String jobId, String modelVersion, float score) {
}
