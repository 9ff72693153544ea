package eu.virtualparadox.knowledge.ingest.error;

/**
 * Network blip, store momentarily unavailable, model endpoint throttling.
 * Retried with backoff up to a bounded number of attempts.
 */
public class TransientIngestionException extends IngestionException {

    public TransientIngestionException(final EFailureReason reason, final String message) {
        super(reason, message, null);
    }

    public TransientIngestionException(final EFailureReason reason, final String message, final Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
