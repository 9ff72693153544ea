package eu.virtualparadox.knowledge.ingest.source;

/**
 * Strategy for one kind of source reference.
 * <p>
 * Direct sources return their text from {@link #fetch(String)}. Sources that need an external
 * transcription job report {@link #requiresTranscription()} instead and only provide the
 * reference to hand to the {@link TranscriptionClient}.
 * </p>
 */
public interface ContentSource {

    /**
     * Short name used in logs.
     */
    String name();

    boolean supports(String sourceRef);

    default boolean requiresTranscription() {
        return false;
    }

    /**
     * Retrieves the text of a direct source.
     *
     * @throws eu.virtualparadox.knowledge.ingest.error.TransientIngestionException if trying again may help
     * @throws eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException if the source cannot be read
     */
    SourceContent fetch(String sourceRef);

    /**
     * Reference submitted to the transcription service, for sources that need one.
     */
    default String transcriptionRef(final String sourceRef) {
        return sourceRef;
    }
}
