package eu.virtualparadox.knowledge.ingest.source;

public enum ETranscriptionState {
    PENDING,
    READY,
    FAILED
}
