package eu.virtualparadox.knowledge.ingest.chunker;

import java.util.List;

/**
 * Counts the tokens the chunk budget is measured in.
 * <p>
 * Tokens never contain whitespace, so any whitespace position is a safe place to cut.
 * </p>
 */
public interface TokenCounter {

    /**
     * Token spans inside {@code text[from, to)}, as absolute offsets into {@code text}.
     */
    List<TokenSpan> tokens(String text, int from, int to);

    default int count(final String text) {
        return text == null ? 0 : tokens(text, 0, text.length()).size();
    }
}
