package eu.virtualparadox.knowledge.ingest.model;

/**
 * Per-job knobs accepted at submission. {@code null} means "use the configured default".
 *
 * @param skipConcepts          disable concept extraction for this job
 * @param chunkTokenBudget      maximum tokens per chunk
 * @param chunkOverlap          maximum tokens carried over from the previous chunk
 * @param embeddingModelVersion embedding model to use
 */
public record IngestionOptions(boolean skipConcepts,
                               Integer chunkTokenBudget,
                               Integer chunkOverlap,
                               String embeddingModelVersion) {

    public static IngestionOptions defaults() {
        return new IngestionOptions(false, null, null, null);
    }
}
