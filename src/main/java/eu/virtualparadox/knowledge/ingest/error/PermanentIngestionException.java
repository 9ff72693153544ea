package eu.virtualparadox.knowledge.ingest.error;

/**
 * Malformed content, unsupported source, model rejecting its input.
 * Never retried; the job fails immediately.
 */
public class PermanentIngestionException extends IngestionException {

    public PermanentIngestionException(final EFailureReason reason, final String message) {
        super(reason, message, null);
    }

    public PermanentIngestionException(final EFailureReason reason, final String message, final Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
