package eu.virtualparadox.knowledge.util;

public class LuceneConstants {
    // vector index
    /** Vector fields are named per dimension, e.g. {@code vector_384}, so models of different size can coexist. */
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_VECTOR_ID = "vectorId";
    public static final String FIELD_JOB_ID = "jobId";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_MODEL_VERSION = "modelVersion";
    public static final String FIELD_METADATA_PREFIX = "meta.";

    // graph index
    public static final String FIELD_TRIPLE_ID = "tripleId";
    public static final String FIELD_SUBJECT = "subject";
    public static final String FIELD_PREDICATE = "predicate";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ORDINAL = "ordinal";

    private LuceneConstants() {
        // prevent instantiation
    }
}
