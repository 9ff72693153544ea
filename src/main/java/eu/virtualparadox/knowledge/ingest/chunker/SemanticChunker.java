package eu.virtualparadox.knowledge.ingest.chunker;

import eu.virtualparadox.knowledge.ingest.cleaner.NormalizedText;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.pipeline.Processor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence- and paragraph-aware chunker that produces token-bounded, overlapping chunks.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Units:</strong> the normalized text is cut into paragraphs (at {@code "\n\n"} and at
 *       section boundaries) and every paragraph into sentences. Each unit keeps the whitespace that
 *       follows it, so the units tile the text and every chunk is an exact substring of it.</li>
 *   <li><strong>Packing:</strong> units are greedily added until the next one would exceed the token
 *       budget. The chunk is then closed at the latest paragraph boundary, provided the chunk keeps at
 *       least half of the budget; otherwise at the latest sentence boundary.</li>
 *   <li><strong>Overlap:</strong> the next chunk starts with up to {@code overlapTokens} trailing tokens
 *       of the closed chunk's own content, fewer if the incoming unit would not fit otherwise.</li>
 *   <li><strong>Hard cut:</strong> a single sentence longer than the budget is cut at token boundaries.
 *       Its pieces are flagged {@code degraded} and a warning is logged.</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * For the produced chunks {@code c0..cn}: {@code c0.startOffset == 0}, {@code cn.endOffset == text.length()},
 * {@code c(i+1).startOffset <= ci.endOffset}, the overlap {@code [c(i+1).startOffset, ci.endOffset)} holds at most
 * {@code overlapTokens} tokens, and {@code tokenCount <= tokenBudget} for every chunk.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless; identical input yields identical chunks and chunk ids.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SemanticChunker implements Processor<ChunkingRequest, List<Chunk>> {

    public static final String STAGE_NAME = "chunk";

    private static final String PARAGRAPH_BREAK = "\n\n";

    /**
     * Unicode-capital-aware sentence boundary:
     * <pre>
     *     (?&lt;=[.!?])     # trailing ., ! or ? must precede the split
     *     (?![.!?])        # do not allow runs of punctuation to trigger multiple splits
     *     \s+              # one or more whitespace characters form the divider
     *     (?=[\p{Lu}"'])   # next sentence starts with uppercase/quote
     * </pre>
     */
    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<=[.!?])" +
                    "(?![.!?])" +
                    "\\s+" +
                    "(?=[\\p{Lu}\"'])"
    );

    /**
     * Abbreviation guard, checked on a short window right before a split candidate.
     */
    private static final Pattern ABBREVIATION_PATTERN = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Prof|Sr|Jr|Inc|Ltd|Corp|Co|St|Ave|Blvd|Rd|etc|vs|eg|ie|cf|ca|approx|Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec|Mon|Tue|Wed|Thu|Fri|Sat|Sun|U\\.S\\.A|U\\.K|U\\.N)\\.$"
    );

    private final TokenCounter tokenCounter;

    @Override
    public String name() {
        return STAGE_NAME;
    }

    @Override
    public List<Chunk> process(final ChunkingRequest request) {
        return chunk(request.jobId(), request.text(), request.settings());
    }

    /**
     * Splits normalized text into ordered chunks.
     *
     * @param jobId    owning job (non-blank)
     * @param text     normalized text with section information
     * @param settings budget and overlap
     * @return ordered chunks, empty when the text is blank
     */
    public List<Chunk> chunk(final String jobId, final NormalizedText text, final ChunkingSettings settings) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        final String source = text.getText();
        if (source.isBlank()) {
            return new ArrayList<>();
        }

        final List<TextUnit> units = buildUnits(source, text.sectionBoundaries());
        return new Packer(jobId, source, settings).pack(units);
    }

    // === Unit splitting ===

    private List<TextUnit> buildUnits(final String text, final List<Integer> sectionBoundaries) {
        final List<TextUnit> units = new ArrayList<>();
        for (final SentenceSpan paragraph : splitParagraphs(text, sectionBoundaries)) {
            boolean first = true;
            for (final SentenceSpan sentence : splitSentences(text, paragraph)) {
                final int tokens = sentence.countTokens(tokenCounter, text);
                if (tokens == 0 && !units.isEmpty() && !first) {
                    // punctuation-free trailing fragment, fold it into the previous unit
                    final TextUnit prev = units.remove(units.size() - 1);
                    units.add(new TextUnit(prev.start(), sentence.end(), prev.tokenCount(), prev.startsParagraph()));
                    continue;
                }
                units.add(new TextUnit(sentence.start(), sentence.end(), tokens, first && paragraph.start() > 0));
                first = false;
            }
        }
        return units;
    }

    /**
     * Paragraph spans tiling the text. A paragraph owns the break that ends it.
     * Section boundaries only count where they follow whitespace, so a token is never split.
     */
    private static List<SentenceSpan> splitParagraphs(final String text, final List<Integer> sectionBoundaries) {
        final TreeSet<Integer> starts = new TreeSet<>();
        int idx = text.indexOf(PARAGRAPH_BREAK);
        while (idx >= 0) {
            final int next = idx + PARAGRAPH_BREAK.length();
            if (next < text.length()) {
                starts.add(next);
            }
            idx = text.indexOf(PARAGRAPH_BREAK, next);
        }
        for (final Integer boundary : sectionBoundaries) {
            if (boundary > 0 && boundary < text.length() && Character.isWhitespace(text.charAt(boundary - 1))) {
                starts.add(boundary);
            }
        }

        final List<SentenceSpan> paragraphs = new ArrayList<>();
        int start = 0;
        for (final Integer next : starts) {
            paragraphs.add(new SentenceSpan(start, next));
            start = next;
        }
        paragraphs.add(new SentenceSpan(start, text.length()));
        return paragraphs;
    }

    /**
     * Sentence spans tiling one paragraph; each sentence keeps its trailing whitespace.
     */
    private static List<SentenceSpan> splitSentences(final String text, final SentenceSpan paragraph) {
        final List<SentenceSpan> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_SPLIT.matcher(text);
        matcher.region(paragraph.start(), paragraph.end());

        int lastStart = paragraph.start();
        while (matcher.find()) {
            final int splitPoint = matcher.start();
            final String beforeSplit = text.substring(Math.max(lastStart, splitPoint - 20), splitPoint).trim();
            if (!ABBREVIATION_PATTERN.matcher(beforeSplit).find() && matcher.end() > lastStart) {
                sentences.add(new SentenceSpan(lastStart, matcher.end()));
                lastStart = matcher.end();
            }
        }
        if (lastStart < paragraph.end()) {
            sentences.add(new SentenceSpan(lastStart, paragraph.end()));
        }
        return sentences;
    }

    // === Packing ===

    /**
     * Mutable packing state for a single call.
     */
    private final class Packer {
        private final String jobId;
        private final String text;
        private final int budget;
        private final int overlapTokens;

        private final List<Chunk> chunks = new ArrayList<>();

        /** Start offset of the open chunk, overlap included. */
        private int start;
        /** Tokens in the open chunk, overlap included. */
        private int tokens;
        /** Own units of the open chunk are {@code units[first, i)}. */
        private int first;
        /** Own content range of the last closed chunk, source of the next overlap. */
        private int lastContentStart = -1;
        private int lastContentEnd = -1;

        Packer(final String jobId, final String text, final ChunkingSettings settings) {
            this.jobId = jobId;
            this.text = text;
            this.budget = settings.tokenBudget();
            this.overlapTokens = settings.overlapTokens();
        }

        List<Chunk> pack(final List<TextUnit> units) {
            int i = 0;
            first = 0;
            while (i < units.size()) {
                final TextUnit unit = units.get(i);

                // Case 1: the unit alone exceeds the budget
                if (unit.tokenCount() > budget) {
                    if (i > first) {
                        close(units.get(first).start(), unit.start());
                    }
                    hardCut(unit);
                    i++;
                    first = i;
                    continue;
                }

                // Case 2: first own unit of a new chunk, carry the overlap
                if (i == first) {
                    open(unit);
                    i++;
                    continue;
                }

                // Case 3: fits
                if (tokens + unit.tokenCount() <= budget) {
                    tokens += unit.tokenCount();
                    i++;
                    continue;
                }

                // Case 4: overflow, close at the best boundary in (first, i]
                final int closeAt = chooseBoundary(units, i);
                int closedTokens = tokens;
                for (int j = closeAt; j < i; j++) {
                    closedTokens -= units.get(j).tokenCount();
                }
                tokens = closedTokens;
                close(units.get(first).start(), units.get(closeAt).start());
                i = closeAt;
                first = i;
            }

            if (first < units.size()) {
                close(units.get(first).start(), text.length());
            }
            return chunks;
        }

        /**
         * Latest paragraph boundary keeping the chunk at least half full, otherwise the sentence
         * boundary right before the overflowing unit.
         */
        private int chooseBoundary(final List<TextUnit> units, final int overflowing) {
            int tokensBefore = tokens;
            for (int j = overflowing; j > first; j--) {
                if (j < overflowing) {
                    tokensBefore -= units.get(j).tokenCount();
                }
                if (tokensBefore * 2 < budget) {
                    break;
                }
                if (units.get(j).startsParagraph()) {
                    return j;
                }
            }
            return overflowing;
        }

        private void open(final TextUnit unit) {
            final int carried = carryOverlap(budget - unit.tokenCount());
            tokens = carried + unit.tokenCount();
        }

        /**
         * Sets {@link #start} to include up to {@code room} trailing tokens of the last chunk's own content.
         *
         * @return number of tokens carried
         */
        private int carryOverlap(final int room) {
            final int nextStart = lastContentEnd < 0 ? 0 : lastContentEnd;
            start = nextStart;
            if (lastContentStart < 0 || overlapTokens == 0 || room <= 0) {
                return 0;
            }
            final List<TokenSpan> tail = tokenCounter.tokens(text, lastContentStart, lastContentEnd);
            final int carried = Math.min(Math.min(overlapTokens, room), tail.size());
            if (carried == 0) {
                return 0;
            }
            start = tail.get(tail.size() - carried).start();
            return carried;
        }

        private void hardCut(final TextUnit unit) {
            final List<TokenSpan> unitTokens = tokenCounter.tokens(text, unit.start(), unit.end());
            log.warn("Sentence of {} tokens at offset {} exceeds the budget of {} tokens in job {}, hard-cutting it",
                    unitTokens.size(), unit.start(), budget, jobId);

            int p = 0;
            boolean firstPiece = true;
            while (p < unitTokens.size()) {
                final int carried = carryOverlap(budget - 1);
                final int take = Math.min(budget - carried, unitTokens.size() - p);
                final int pieceContentStart = firstPiece ? unit.start() : unitTokens.get(p).start();
                final int pieceEnd = p + take >= unitTokens.size() ? unit.end() : unitTokens.get(p + take).start();
                tokens = carried + take;
                emit(pieceEnd, true);
                lastContentStart = pieceContentStart;
                lastContentEnd = pieceEnd;
                p += take;
                firstPiece = false;
            }
        }

        private void close(final int contentStart, final int end) {
            emit(end, false);
            lastContentStart = contentStart;
            lastContentEnd = end;
        }

        private void emit(final int end, final boolean degraded) {
            final int seq = chunks.size();
            chunks.add(new Chunk(
                    Chunk.buildId(jobId, seq),
                    jobId,
                    seq,
                    text.substring(start, end),
                    tokens,
                    start,
                    end,
                    degraded
            ));
        }
    }
}
