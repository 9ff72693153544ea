package eu.virtualparadox.knowledge.ingest.error;

/**
 * Raised by store adapters when a read or write against their backing system fails.
 * The write coordinator decides how a given store failure affects the job.
 */
public class StoreException extends RuntimeException {

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
