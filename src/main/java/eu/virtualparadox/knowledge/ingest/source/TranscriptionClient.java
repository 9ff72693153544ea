package eu.virtualparadox.knowledge.ingest.source;

/**
 * External transcription service. Polling the same job repeatedly must be safe.
 */
public interface TranscriptionClient {

    /**
     * @return the external job id
     */
    String submitJob(String sourceRef);

    TranscriptionStatus poll(String externalJobId);
}
