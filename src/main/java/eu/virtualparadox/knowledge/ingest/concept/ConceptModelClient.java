package eu.virtualparadox.knowledge.ingest.concept;

/**
 * Model call that proposes concepts and relations for a piece of text.
 * <p>
 * Implementations throw {@link eu.virtualparadox.knowledge.ingest.error.TransientIngestionException}
 * for rate limits, server errors and I/O problems, and
 * {@link eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException} when the model rejects the input.
 * </p>
 */
public interface ConceptModelClient {

    ConceptModelResult extract(String text);
}
