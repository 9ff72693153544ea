package eu.virtualparadox.knowledge.ingest.source;

import java.util.List;

/**
 * Raw text retrieved from a source.
 *
 * @param text          the text, not yet normalized
 * @param sectionStarts offsets in {@code text} where a page, heading or other section begins
 */
public record SourceContent(String text, List<Integer> sectionStarts) {

    public SourceContent {
        text = text == null ? "" : text;
        sectionStarts = sectionStarts == null ? List.of() : List.copyOf(sectionStarts);
    }

    public static SourceContent plain(final String text) {
        return new SourceContent(text, List.of());
    }
}
