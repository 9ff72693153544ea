package eu.virtualparadox.knowledge.ingest.error;

/**
 * A best-effort enrichment failed while core retrieval stayed usable.
 * Surfaces as {@code INDEXED_DEGRADED} instead of {@code FAILED}.
 */
public class DegradedIngestionException extends IngestionException {

    public DegradedIngestionException(final EFailureReason reason, final String message, final Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
