package eu.virtualparadox.knowledge.rag.index;

import java.util.Map;

/**
 * A vector to write, with the identifiers every stored vector must carry.
 *
 * @param chunkId      chunk the vector was computed from
 * @param jobId        owning job
 * @param vector       dense vector
 * @param modelVersion embedding model that produced it
 * @param metadata     extra filterable attributes, may be empty
 */
public record VectorRecord(String chunkId,
                           String jobId,
                           float[] vector,
                           String modelVersion,
                           Map<String, String> metadata) {

    public VectorRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Update key of a stored vector: {@code chunkId@modelVersion}.
     */
    public static String vectorId(final String chunkId, final String modelVersion) {
        return chunkId + "@" + modelVersion;
    }

    public String vectorId() {
        return vectorId(chunkId, modelVersion);
    }
}
