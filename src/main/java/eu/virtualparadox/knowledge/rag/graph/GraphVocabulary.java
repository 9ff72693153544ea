package eu.virtualparadox.knowledge.rag.graph;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Names used in the concept graph.
 */
public final class GraphVocabulary {

    public static final String RDF_TYPE = "rdf:type";
    public static final String RDFS_LABEL = "rdfs:label";

    public static final String KN_PREFIX = "kn:";
    public static final String KN_CONCEPT = KN_PREFIX + "Concept";
    public static final String KN_MENTIONED_IN = KN_PREFIX + "mentionedIn";

    // provenance
    public static final String KN_SOURCE = KN_PREFIX + "Source";
    public static final String KN_CHUNK = KN_PREFIX + "Chunk";
    public static final String KN_SOURCE_URL = KN_PREFIX + "sourceUrl";
    public static final String KN_SOURCE_TYPE = KN_PREFIX + "sourceType";
    public static final String KN_JOB_ID = KN_PREFIX + "jobId";
    public static final String KN_CHUNK_INDEX = KN_PREFIX + "chunkIndex";
    public static final String KN_VECTOR_ID = KN_PREFIX + "vectorId";
    public static final String KN_DERIVED_FROM = KN_PREFIX + "derivedFrom";

    private GraphVocabulary() {
        // prevent instantiation
    }

    /**
     * Concept node, scoped to the job so that jobs never share graph nodes.
     */
    public static String conceptNode(final String jobId, final String label) {
        return KN_PREFIX + "job/" + jobId + "/concept/" + slug(label);
    }

    public static String sourceNode(final String jobId) {
        return KN_PREFIX + "job/" + jobId + "/source";
    }

    public static String chunkNode(final String chunkId) {
        return KN_PREFIX + "chunk/" + chunkId;
    }

    public static String predicate(final String relation) {
        return KN_PREFIX + relation;
    }

    /**
     * Lower-case ASCII slug: accents stripped, every other run of non-alphanumerics becomes one dash.
     */
    static String slug(final String label) {
        final String ascii = Normalizer.normalize(label, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase(Locale.ROOT);
        final String slug = ascii.replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "_" : slug;
    }
}
