package eu.virtualparadox.knowledge.job;

import java.util.Map;

/**
 * Names and payload layout of the tasks driving a job.
 */
public final class IngestionTasks {

    public static final String START = "ingest.start";
    public static final String POLL = "ingest.poll";
    public static final String PROCESS = "ingest.process";
    public static final String REINDEX = "ingest.reindex";

    static final String JOB_ID = "jobId";

    private IngestionTasks() {
        // prevent instantiation
    }

    public static Map<String, String> payload(final String jobId) {
        return Map.of(JOB_ID, jobId);
    }

    public static String jobId(final Map<String, String> payload) {
        final String jobId = payload.get(JOB_ID);
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("Task payload carries no job id: " + payload);
        }
        return jobId;
    }
}
