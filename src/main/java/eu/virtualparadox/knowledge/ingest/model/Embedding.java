package eu.virtualparadox.knowledge.ingest.model;

/**
 * Dense vector for one chunk under one embedding model version.
 */
public record Embedding(String chunkId, float[] vector, String modelVersion) {

    public int dimension() {
        return vector.length;
    }
}
