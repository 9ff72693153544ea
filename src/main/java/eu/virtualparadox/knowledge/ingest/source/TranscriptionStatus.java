package eu.virtualparadox.knowledge.ingest.source;

/**
 * Result of one poll of an external transcription job.
 *
 * @param state state of the external job
 * @param text  transcript when {@code READY}
 * @param error failure description when {@code FAILED}
 */
public record TranscriptionStatus(ETranscriptionState state, String text, String error) {

    public static TranscriptionStatus pending() {
        return new TranscriptionStatus(ETranscriptionState.PENDING, null, null);
    }

    public static TranscriptionStatus ready(final String text) {
        return new TranscriptionStatus(ETranscriptionState.READY, text, null);
    }

    public static TranscriptionStatus failed(final String error) {
        return new TranscriptionStatus(ETranscriptionState.FAILED, null, error);
    }
}
