package eu.virtualparadox.knowledge.catalog.service;

import java.util.List;
import java.util.Optional;

/**
 * Source of truth for chunk identity and text.
 * <p>
 * Written first during WRITING so that vectors and graph triples never reference a chunk
 * that does not exist. Failures surface as {@link eu.virtualparadox.knowledge.ingest.error.StoreException}.
 * </p>
 */
public interface DocumentStore {

    void putChunk(StoredChunk chunk);

    /**
     * Replaces all chunks of a job. Rows with a sequence index beyond the new set are removed.
     */
    void putChunks(String jobId, List<StoredChunk> chunks);

    Optional<StoredChunk> getChunk(String chunkId);

    /**
     * @return the job's chunks in sequence order
     */
    List<StoredChunk> listChunks(String jobId);

    void markIndexed(String jobId, boolean indexed);

    void deleteByJobId(String jobId);
}
