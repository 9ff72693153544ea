package eu.virtualparadox.knowledge.ingest.chunker;

import eu.virtualparadox.knowledge.ingest.cleaner.NormalizedText;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SemanticChunkerTest {

    private static final String TWO_PARAGRAPHS =
            "Alpha beta gamma. Delta epsilon zeta. Eta theta iota.\n\n" +
                    "Kappa lambda mu. Nu xi omicron. Pi rho sigma.";

    private final TokenCounter counter = new RegexTokenCounter();
    private final SemanticChunker chunker = new SemanticChunker(counter);

    // ---------- Helpers ----------

    private static String buildSentences(int count, long seed) {
        StringBuilder sb = new StringBuilder();
        Random rnd = new Random(seed);
        for (int i = 0; i < count; i++) {
            int words = 3 + rnd.nextInt(12);
            for (int w = 0; w < words; w++) {
                String word = randomWord(rnd);
                if (w == 0) {
                    word = Character.toUpperCase(word.charAt(0)) + word.substring(1);
                }
                sb.append(word).append(w == words - 1 ? ". " : " ");
            }
            if (rnd.nextInt(5) == 0) {
                sb.append("\n\n");
            }
        }
        return sb.toString().trim();
    }

    private static String randomWord(Random rnd) {
        int len = 2 + rnd.nextInt(8);
        StringBuilder s = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            s.append((char) ('a' + rnd.nextInt(26)));
        }
        return s.toString();
    }

    private List<Chunk> chunk(String text, int budget, int overlap) {
        return chunker.chunk("job1", NormalizedText.ofPlain(text), new ChunkingSettings(budget, overlap));
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Blank text yields no chunks")
    void blankText_yieldsNoChunks() {
        assertTrue(chunk("   ", 10, 2).isEmpty());
        assertTrue(chunk("", 10, 2).isEmpty());
    }

    @Test
    @DisplayName("Short text fits into a single chunk covering the whole text")
    void shortText_singleChunk() {
        String text = "Hello world. This is short.";
        List<Chunk> chunks = chunk(text, 100, 10);

        assertEquals(1, chunks.size());
        Chunk c = chunks.get(0);
        assertEquals("job1_00000", c.id());
        assertEquals("job1", c.jobId());
        assertEquals(0, c.sequenceIndex());
        assertEquals(text, c.text());
        assertEquals(0, c.startOffset());
        assertEquals(text.length(), c.endOffset());
        assertEquals(counter.count(text), c.tokenCount());
        assertFalse(c.degraded());
    }

    @Test
    @DisplayName("Chunk closes at the paragraph boundary when it keeps the chunk half full")
    void prefersParagraphBoundary() {
        List<Chunk> chunks = chunk(TWO_PARAGRAPHS, 16, 0);

        assertEquals(2, chunks.size());
        assertEquals("Alpha beta gamma. Delta epsilon zeta. Eta theta iota.\n\n", chunks.get(0).text());
        assertEquals(12, chunks.get(0).tokenCount());
        assertEquals("Kappa lambda mu. Nu xi omicron. Pi rho sigma.", chunks.get(1).text());
        assertEquals(chunks.get(0).endOffset(), chunks.get(1).startOffset());
    }

    @Test
    @DisplayName("Next chunk starts with the trailing tokens of the previous one")
    void carriesOverlap() {
        List<Chunk> chunks = chunk(TWO_PARAGRAPHS, 16, 3);

        assertEquals(2, chunks.size());
        Chunk second = chunks.get(1);
        assertTrue(second.text().startsWith("theta iota.\n\nKappa"), second.text());
        assertEquals(15, second.tokenCount());
        assertTrue(second.startOffset() < chunks.get(0).endOffset());
    }

    @Test
    @DisplayName("Oversized sentence is hard-cut into degraded pieces within budget")
    void oversizedSentence_hardCut() {
        StringBuilder sb = new StringBuilder("Start");
        for (int i = 0; i < 49; i++) {
            sb.append(" word");
        }
        sb.append('.');
        String text = sb.toString();

        List<Chunk> chunks = chunk(text, 10, 2);

        assertTrue(chunks.size() >= 6, "expected several pieces, got " + chunks.size());
        for (Chunk c : chunks) {
            assertTrue(c.degraded(), "piece must be flagged degraded");
            assertTrue(c.tokenCount() <= 10);
        }
        assertEquals(text.length(), chunks.get(chunks.size() - 1).endOffset());
    }

    @Test
    @DisplayName("Chunks tile the text, respect budget and overlap limits")
    void invariantsHoldOnLongText() {
        String text = buildSentences(300, 42);
        int budget = 40;
        int overlap = 8;

        List<Chunk> chunks = chunk(text, budget, overlap);

        assertTrue(chunks.size() > 5);
        assertEquals(0, chunks.get(0).startOffset());
        assertEquals(text.length(), chunks.get(chunks.size() - 1).endOffset());

        for (int i = 0; i < chunks.size(); i++) {
            Chunk c = chunks.get(i);
            assertEquals(i, c.sequenceIndex());
            assertEquals(text.substring(c.startOffset(), c.endOffset()), c.text());
            assertTrue(c.tokenCount() <= budget, "chunk " + i + " has " + c.tokenCount() + " tokens");
            assertEquals(counter.count(c.text()), c.tokenCount());

            if (i > 0) {
                Chunk prev = chunks.get(i - 1);
                assertTrue(c.startOffset() <= prev.endOffset(), "gap before chunk " + i);
                String shared = text.substring(c.startOffset(), prev.endOffset());
                assertTrue(counter.count(shared) <= overlap, "overlap too large before chunk " + i);
            }
        }
    }

    @Test
    @DisplayName("Same input yields identical chunks")
    void deterministic() {
        String text = buildSentences(80, 7);
        assertEquals(chunk(text, 30, 5), chunk(text, 30, 5));
    }

    @Test
    @DisplayName("Section boundaries start a new paragraph unit")
    void sectionBoundaryActsAsParagraph() {
        String text = "Page one text is here. More on page one. Page two starts. It ends here.";
        int boundary = text.indexOf("Page two");
        int[] map = new int[text.length()];
        for (int i = boundary; i < map.length; i++) {
            map[i] = 1;
        }

        List<Chunk> chunks = chunker.chunk("job1", new NormalizedText(text, map), new ChunkingSettings(14, 0));

        assertEquals(2, chunks.size());
        assertEquals(boundary, chunks.get(1).startOffset());
    }

    @Test
    @DisplayName("Invalid settings are rejected as invalid options")
    void invalidSettings() {
        PermanentIngestionException e = assertThrows(PermanentIngestionException.class,
                () -> new ChunkingSettings(10, 10));
        assertEquals(EFailureReason.INVALID_OPTIONS, e.getReason());
        assertThrows(PermanentIngestionException.class, () -> new ChunkingSettings(0, 0));
    }
}
