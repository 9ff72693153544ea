package eu.virtualparadox.knowledge.ingest.error;

/**
 * Base class of the ingestion error taxonomy.
 * <p>Every instance carries the {@link EFailureReason} that ends up on the job if the
 * error is not recovered from.</p>
 */
public abstract class IngestionException extends RuntimeException {

    private final EFailureReason reason;

    protected IngestionException(final EFailureReason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public EFailureReason getReason() {
        return reason;
    }

    /**
     * @return {@code true} if retrying the same operation may succeed
     */
    public abstract boolean isTransient();
}
