package eu.virtualparadox.knowledge.ingest.chunker;

/**
 * Half-open span {@code [start, end)} of the normalized text: a paragraph, or one sentence of it.
 */
record SentenceSpan(int start, int end) {

    SentenceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    int countTokens(final TokenCounter counter, final String text) {
        return counter.tokens(text, start, end).size();
    }
}
