package eu.virtualparadox.knowledge.ingest.error;

/**
 * Thrown at a cancellation checkpoint once a job has been asked to stop.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(final String jobId) {
        super("Job cancelled: " + jobId);
    }
}
