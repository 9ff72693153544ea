package eu.virtualparadox.knowledge.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for texts.
 * <p>
 * The only contract the pipeline relies on: text in, one vector of length {@link #dimension()} out,
 * in input order. Identical text and {@link #modelVersion()} always give the identical vector.
 * </p>
 */
public interface EmbeddingService {

    /**
     * Identifier stored with every vector; changes whenever the vectors would change.
     */
    String modelVersion();

    /**
     * Fixed vector length {@code D} of this model.
     */
    int dimension();

    /**
     * Embeds the given texts in one batch.
     *
     * @param texts texts to embed
     * @return one vector per text, same order
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single query string, used by the search side.
     */
    default float[] embedQuery(final String text) {
        return embed(List.of(text)).get(0);
    }
}
