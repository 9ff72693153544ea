package eu.virtualparadox.knowledge.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.IntPredicate;

/**
 * Normalizes retrieved source text before chunking.
 * <p>
 * Removes control characters, zero-width spaces and soft hyphens, keeps diacritics,
 * collapses whitespace and keeps paragraph breaks as a single {@code "\n\n"}. A single
 * line break is treated as a wrapped line and becomes a space.
 * </p>
 * <p>
 * Every transformation carries a per-character section map along, so section boundaries
 * supplied as offsets into the raw text (e.g. PDF page starts) survive normalization.
 * </p>
 */
@Component
public class TextNormalizer {

    private static final String PARAGRAPH_BREAK = "\n\n";

    /**
     * Normalizes text without section information.
     *
     * @param input raw text
     * @return normalized text
     */
    public String normalize(final String input) {
        return normalize(input, null).getText();
    }

    /**
     * Normalizes text while maintaining the character-to-section mapping.
     *
     * @param input         raw text
     * @param sectionStarts ascending offsets into {@code input} where a new section starts, may be {@code null}
     * @return normalized text with its section map
     */
    public NormalizedText normalize(final String input, final List<Integer> sectionStarts) {
        if (input == null || input.isEmpty()) {
            return new NormalizedText("", new int[0]);
        }

        CleaningStep step = new CleaningStep(input, buildSectionMap(input.length(), sectionStarts));

        // Step 1: CR LF and lone CR become LF; form feed and vertical tab behave like line breaks
        step = normalizeLineEndings(step);

        // Step 2: zero-width characters and BOM become spaces
        step = replaceMatching(step, c -> c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\uFEFF', ' ');

        // Step 3: non-breaking space becomes a regular space
        step = replaceMatching(step, c -> c == '\u00A0', ' ');

        // Step 4: soft hyphen is removed
        step = removeMatching(step, c -> c == '\u00AD');

        // Step 5: other format characters become spaces
        step = replaceMatching(step, c -> Character.getType(c) == Character.FORMAT, ' ');

        // Step 6: tabs become spaces, remaining control characters are removed
        step = replaceMatching(step, c -> c == '\t', ' ');
        step = removeMatching(step, c -> Character.isISOControl(c) && c != '\n');

        // Step 7: whitespace runs collapse to a paragraph break or a single space
        step = collapseWhitespace(step);

        // Step 8: trim
        step = trimText(step);

        return new NormalizedText(step.text, step.sectionMap);
    }

    private static int[] buildSectionMap(final int length, final List<Integer> sectionStarts) {
        final int[] map = new int[length];
        if (sectionStarts == null || sectionStarts.isEmpty()) {
            return map;
        }
        int section = 0;
        int next = 0;
        for (int i = 0; i < length; i++) {
            while (next < sectionStarts.size() && sectionStarts.get(next) <= i) {
                if (sectionStarts.get(next) > 0) {
                    section++;
                }
                next++;
            }
            map[i] = section;
        }
        return map;
    }

    // === Private helper methods ===

    private static class CleaningStep {
        final String text;
        final int[] sectionMap;

        CleaningStep(final String text, final int[] sectionMap) {
            this.text = text;
            this.sectionMap = sectionMap;
        }
    }

    private CleaningStep normalizeLineEndings(final CleaningStep in) {
        final Builder out = new Builder(in.text.length());
        final String text = in.text;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    continue;
                }
                out.append('\n', in.sectionMap[i]);
            } else if (c == '\f' || c == '\u000B') {
                out.append('\n', in.sectionMap[i]);
            } else {
                out.append(c, in.sectionMap[i]);
            }
        }
        return out.build();
    }

    private CleaningStep replaceMatching(final CleaningStep in, final IntPredicate predicate, final char replacement) {
        final Builder out = new Builder(in.text.length());
        for (int i = 0; i < in.text.length(); i++) {
            final char c = in.text.charAt(i);
            // 1:1 replacement, the section mapping stays the same
            out.append(predicate.test(c) ? replacement : c, in.sectionMap[i]);
        }
        return out.build();
    }

    private CleaningStep removeMatching(final CleaningStep in, final IntPredicate predicate) {
        final Builder out = new Builder(in.text.length());
        for (int i = 0; i < in.text.length(); i++) {
            final char c = in.text.charAt(i);
            if (!predicate.test(c)) {
                out.append(c, in.sectionMap[i]);
            }
        }
        return out.build();
    }

    private CleaningStep collapseWhitespace(final CleaningStep in) {
        final String text = in.text;
        final Builder out = new Builder(text.length());

        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                out.append(c, in.sectionMap[i]);
                i++;
                continue;
            }

            // whitespace run [i, j): keep the section of its first character
            final int runStart = i;
            int newlines = 0;
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                if (text.charAt(i) == '\n') {
                    newlines++;
                }
                i++;
            }
            final int section = in.sectionMap[runStart];
            if (newlines >= 2) {
                for (int k = 0; k < PARAGRAPH_BREAK.length(); k++) {
                    out.append(PARAGRAPH_BREAK.charAt(k), section);
                }
            } else {
                out.append(' ', section);
            }
        }
        return out.build();
    }

    private CleaningStep trimText(final CleaningStep in) {
        int start = 0;
        int end = in.text.length();

        while (start < end && Character.isWhitespace(in.text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(in.text.charAt(end - 1))) {
            end--;
        }

        if (start >= end) {
            return new CleaningStep("", new int[0]);
        }

        final int[] trimmedMap = new int[end - start];
        System.arraycopy(in.sectionMap, start, trimmedMap, 0, end - start);
        return new CleaningStep(in.text.substring(start, end), trimmedMap);
    }

    private static final class Builder {
        private final StringBuilder text;
        private int[] map;
        private int size;

        Builder(final int capacity) {
            this.text = new StringBuilder(capacity);
            this.map = new int[Math.max(capacity, 1)];
        }

        void append(final char c, final int section) {
            if (size == map.length) {
                final int[] grown = new int[map.length * 2];
                System.arraycopy(map, 0, grown, 0, size);
                map = grown;
            }
            text.append(c);
            map[size++] = section;
        }

        CleaningStep build() {
            final int[] exact = new int[size];
            System.arraycopy(map, 0, exact, 0, size);
            return new CleaningStep(text.toString(), exact);
        }
    }
}
