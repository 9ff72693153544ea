package eu.virtualparadox.knowledge.ingest.cleaner;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of text normalization: the clean text plus, for every character, the index of the
 * source section it came from.
 */
public class NormalizedText {
    private final String text;
    private final int[] sectionMap;

    public NormalizedText(final String text, final int[] sectionMap) {
        this.text = text;
        this.sectionMap = sectionMap;

        if (text.length() != sectionMap.length) {
            throw new IllegalStateException(
                    "Normalization broke the invariant: text length " + text.length() +
                            " != sectionMap length " + sectionMap.length
            );
        }
    }

    /**
     * Wraps text that is already normalized and has a single section.
     */
    public static NormalizedText ofPlain(final String text) {
        return new NormalizedText(text, new int[text.length()]);
    }

    public String getText() {
        return text;
    }

    public int[] getSectionMap() {
        return sectionMap.clone();
    }

    /**
     * Offsets at which a new section starts, excluding offset 0.
     *
     * @return ascending list of section start offsets
     */
    public List<Integer> sectionBoundaries() {
        final List<Integer> boundaries = new ArrayList<>();
        for (int i = 1; i < sectionMap.length; i++) {
            if (sectionMap[i] != sectionMap[i - 1]) {
                boundaries.add(i);
            }
        }
        return boundaries;
    }
}
