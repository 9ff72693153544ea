package eu.virtualparadox.knowledge.rag.index;

import eu.virtualparadox.knowledge.application.config.LuceneConfig;
import eu.virtualparadox.knowledge.application.config.LuceneIndex;
import eu.virtualparadox.knowledge.ingest.error.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.knowledge.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorStore} using the HNSW k-NN graph.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code vectorId}: {@code chunkId@modelVersion}, the update key</li>
 *   <li>{@code chunkId}, {@code jobId}, {@code modelVersion}: stored identifiers, also filterable</li>
 *   <li>{@code meta.*}: extra metadata, stored and filterable</li>
 *   <li>{@code vector_<dim>}: {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <p>Lucene requires one dimension per vector field, so the field name carries the dimension.
 * Models of different size then live side by side in the same index.</p>
 *
 * <p>Upserts are keyed by vector id, so repeating a batch that failed halfway converges on the
 * same documents instead of duplicating them.</p>
 */
@Slf4j
@Service
public class LuceneVectorStore implements VectorStore {

    private final LuceneIndex index;

    public LuceneVectorStore(@Qualifier(LuceneConfig.VECTOR_INDEX) final LuceneIndex index) {
        this.index = index;
    }

    @Override
    public void upsert(final String chunkId, final float[] vector, final Map<String, String> metadata) {
        requireNonBlank(metadata.get(META_JOB_ID), META_JOB_ID);
        requireNonBlank(metadata.get(META_MODEL_VERSION), META_MODEL_VERSION);
        upsertAll(List.of(new VectorRecord(chunkId,
                metadata.get(META_JOB_ID),
                vector,
                metadata.get(META_MODEL_VERSION),
                metadata)));
    }

    @Override
    public void upsertAll(final List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        for (final VectorRecord r : records) {
            requireNonBlank(r.chunkId(), "chunkId");
            requireNonBlank(r.jobId(), "jobId");
            requireNonBlank(r.modelVersion(), "modelVersion");
            if (r.vector() == null || r.vector().length == 0) {
                throw new IllegalArgumentException("Vector of chunk " + r.chunkId() + " must not be empty");
            }
        }

        try {
            index.update(writer -> {
                for (final VectorRecord r : records) {
                    writer.updateDocument(new Term(FIELD_VECTOR_ID, r.vectorId()), buildLuceneDocument(r));
                }
            });
        } catch (final IOException | IllegalArgumentException e) {
            throw new StoreException("Vector upsert of " + records.size() + " records failed", e);
        }
        log.debug("Upserted {} vectors", records.size());
    }

    @Override
    public List<VectorHit> query(final float[] vector, final int topK, final Map<String, String> filters) {
        if (topK <= 0) {
            return List.of();
        }

        final SearcherManager searcherManager = index.searcherManager();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final KnnFloatVectorQuery knn =
                        new KnnFloatVectorQuery(vectorField(vector.length), vector, topK, buildFilter(filters));
                final TopDocs topDocs = searcher.search(knn, topK);

                final StoredFields storedFields = searcher.storedFields();
                final List<VectorHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final Document doc = storedFields.document(sd.doc);
                    hits.add(new VectorHit(
                            doc.get(FIELD_CHUNK_ID),
                            doc.get(FIELD_JOB_ID),
                            doc.get(FIELD_MODEL_VERSION),
                            sd.score));
                }
                return hits;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StoreException("Vector query failed", e);
        }
    }

    @Override
    public void deleteByJobId(final String jobId) {
        requireNonBlank(jobId, "jobId");
        try {
            index.update(writer -> writer.deleteDocuments(new Term(FIELD_JOB_ID, jobId)));
        } catch (final IOException e) {
            throw new StoreException("Vector delete of job " + jobId + " failed", e);
        }
    }

    @Override
    public int countByJobId(final String jobId) {
        final SearcherManager searcherManager = index.searcherManager();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.count(new TermQuery(new Term(FIELD_JOB_ID, jobId)));
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StoreException("Vector count of job " + jobId + " failed", e);
        }
    }

    static String vectorField(final int dimension) {
        return FIELD_VECTOR + "_" + dimension;
    }

    private Document buildLuceneDocument(final VectorRecord r) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_VECTOR_ID, r.vectorId(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, r.chunkId(), Field.Store.YES));
        d.add(new StringField(FIELD_JOB_ID, r.jobId(), Field.Store.YES));
        d.add(new StringField(FIELD_MODEL_VERSION, r.modelVersion(), Field.Store.YES));

        for (final Map.Entry<String, String> entry : r.metadata().entrySet()) {
            if (isReserved(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            d.add(new StringField(FIELD_METADATA_PREFIX + entry.getKey(), entry.getValue(), Field.Store.YES));
        }

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(vectorField(r.vector().length), r.vector(), VectorSimilarityFunction.COSINE));
        return d;
    }

    /**
     * @return a conjunction of exact-match filters, or {@code null} for no filtering
     */
    private Query buildFilter(final Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (final Map.Entry<String, String> entry : filters.entrySet()) {
            final String field = switch (entry.getKey()) {
                case META_JOB_ID -> FIELD_JOB_ID;
                case META_MODEL_VERSION -> FIELD_MODEL_VERSION;
                default -> FIELD_METADATA_PREFIX + entry.getKey();
            };
            builder.add(new TermQuery(new Term(field, entry.getValue())), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private static boolean isReserved(final String key) {
        return META_JOB_ID.equals(key) || META_MODEL_VERSION.equals(key);
    }

    private static void requireNonBlank(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
