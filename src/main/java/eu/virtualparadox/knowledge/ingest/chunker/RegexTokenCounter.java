package eu.virtualparadox.knowledge.ingest.chunker;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximates model tokens with words, numbers and single punctuation marks.
 * <p>
 * {@code "Dr. Smith's car costs 3.5k!"} yields {@code Dr . Smith's car costs 3.5 k !}.
 * </p>
 */
@Component
public class RegexTokenCounter implements TokenCounter {

    /**
     * <pre>
     *     \p{N}+(?:[.,]\p{N}+)*          # numbers, with decimal or thousand separators
     *   | [\p{L}\p{M}]+(?:['’][\p{L}\p{M}]+)*   # words, with inner apostrophes
     *   | [^\s\p{L}\p{M}\p{N}]          # any other single non-space character
     * </pre>
     */
    private static final Pattern TOKEN = Pattern.compile(
            "\\p{N}+(?:[.,]\\p{N}+)*" +
                    "|[\\p{L}\\p{M}]+(?:['’][\\p{L}\\p{M}]+)*" +
                    "|[^\\s\\p{L}\\p{M}\\p{N}]"
    );

    @Override
    public List<TokenSpan> tokens(final String text, final int from, final int to) {
        final List<TokenSpan> spans = new ArrayList<>();
        final Matcher matcher = TOKEN.matcher(text);
        matcher.region(from, to);
        while (matcher.find()) {
            spans.add(new TokenSpan(matcher.start(), matcher.end()));
        }
        return spans;
    }
}
