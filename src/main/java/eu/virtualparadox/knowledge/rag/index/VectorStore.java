package eu.virtualparadox.knowledge.rag.index;

import java.util.List;
import java.util.Map;

/**
 * Abstraction over the vector index used for approximate nearest neighbour search.
 * <p>
 * There is at most one vector per chunk and model version: writing the same pair again replaces
 * the stored vector. Implementations must accept concurrent upserts for different chunks.
 * Failures surface as {@link eu.virtualparadox.knowledge.ingest.error.StoreException}.
 * </p>
 */
public interface VectorStore {

    /** Metadata key carrying the owning job id. Required. */
    String META_JOB_ID = "jobId";

    /** Metadata key carrying the embedding model version. Required. */
    String META_MODEL_VERSION = "modelVersion";

    /**
     * Adds or replaces the vector of one chunk.
     *
     * @param metadata must contain {@link #META_JOB_ID} and {@link #META_MODEL_VERSION}; other
     *                 entries are stored as filterable attributes
     */
    void upsert(String chunkId, float[] vector, Map<String, String> metadata);

    /**
     * Adds or replaces many vectors and makes them visible in one step.
     */
    void upsertAll(List<VectorRecord> records);

    /**
     * Nearest neighbours of {@code vector}.
     *
     * @param filters exact-match constraints on {@link #META_JOB_ID}, {@link #META_MODEL_VERSION}
     *                or any stored metadata key; empty for none
     * @return up to {@code topK} hits ranked by similarity
     */
    List<VectorHit> query(float[] vector, int topK, Map<String, String> filters);

    void deleteByJobId(String jobId);

    int countByJobId(String jobId);
}
