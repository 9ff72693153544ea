package eu.virtualparadox.knowledge.rag.embed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashingEmbeddingServiceTest {

    private final HashingEmbeddingService service = new HashingEmbeddingService(64);

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    @Test
    @DisplayName("Vectors are unit length, deterministic and carry the dimension in the version")
    void deterministicUnitVectors() {
        List<float[]> first = service.embed(List.of("The quick brown fox", "jumps over the lazy dog"));
        List<float[]> second = service.embed(List.of("The quick brown fox", "jumps over the lazy dog"));

        assertEquals("hashing-64", service.modelVersion());
        assertEquals(2, first.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(64, first.get(i).length);
            assertArrayEquals(first.get(i), second.get(i));
            assertEquals(1.0, dot(first.get(i), first.get(i)), 1e-5);
        }
    }

    @Test
    @DisplayName("Texts sharing vocabulary are closer than unrelated texts")
    void similarity() {
        float[] a = service.embedQuery("lucene vector index search");
        float[] b = service.embedQuery("vector index search engine");
        float[] c = service.embedQuery("banana smoothie recipe");

        assertTrue(dot(a, b) > dot(a, c));
    }

    @Test
    @DisplayName("Text without words still gets a non-zero vector")
    void noWords_nonZero() {
        float[] v = service.embedQuery("!!! ???");
        assertEquals(1.0, dot(v, v), 1e-5);
    }

    @Test
    @DisplayName("Non-positive dimension is rejected")
    void invalidDimension() {
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingService(0));
    }
}
