package eu.virtualparadox.knowledge.rag.graph;

import java.util.List;

/**
 * Store of concept triples, grouped by job.
 * Failures surface as {@link eu.virtualparadox.knowledge.ingest.error.StoreException}.
 */
public interface GraphStore {

    /**
     * Replaces all triples of a job. Writing the same list twice leaves the same graph.
     */
    void putTriples(String jobId, List<Triple> triples);

    /**
     * @return the job's triples in the order they were written
     */
    List<Triple> listTriples(String jobId);

    void deleteByJobId(String jobId);
}
