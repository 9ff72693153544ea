package eu.virtualparadox.knowledge.ingest.chunker;

/**
 * Half-open span {@code [start, end)} of one token in the source text.
 */
public record TokenSpan(int start, int end) {
}
