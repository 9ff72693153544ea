package eu.virtualparadox.knowledge.ingest.error;

/**
 * Stable failure codes written to a job when it ends in {@code FAILED} or {@code INDEXED_DEGRADED}.
 * <p>The {@link #code()} values are part of the external contract and must never be renamed.</p>
 */
public enum EFailureReason {
    UNSUPPORTED_SOURCE("unsupported_source"),
    SOURCE_UNAVAILABLE("source_unavailable"),
    EXTERNAL_SUBMIT_FAILED("external_submit_failed"),
    EXTERNAL_JOB_FAILED("external_job_failed"),
    EXTERNAL_JOB_TIMEOUT("external_job_timeout"),
    EMPTY_CONTENT("empty_content"),
    INVALID_OPTIONS("invalid_options"),
    UNSUPPORTED_EMBEDDING_MODEL("unsupported_embedding_model"),
    PROCESSING_FAILED("processing_failed"),
    PROCESSING_RETRIES_EXHAUSTED("processing_retries_exhausted"),
    WRITE_DOCUMENTS_FAILED("write_documents_failed"),
    WRITE_VECTORS_FAILED("write_vectors_failed"),
    WRITE_GRAPH_FAILED("write_graph_failed"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    EFailureReason(final String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
