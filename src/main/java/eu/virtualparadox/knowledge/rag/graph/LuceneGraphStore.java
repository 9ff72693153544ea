package eu.virtualparadox.knowledge.rag.graph;

import eu.virtualparadox.knowledge.application.config.LuceneConfig;
import eu.virtualparadox.knowledge.application.config.LuceneIndex;
import eu.virtualparadox.knowledge.ingest.error.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static eu.virtualparadox.knowledge.util.LuceneConstants.*;

/**
 * {@link GraphStore} keeping one Lucene document per triple in its own index.
 * <p>
 * A write deletes the job's previous triples and adds the new ones in one index update, so a
 * successful write replaces the job's graph in a single commit. A write that fails while adding
 * may leave the job with part of its new triples once another update commits. Re-indexing the
 * job repeats the whole write and repairs it.
 * </p>
 */
@Slf4j
@Service
public class LuceneGraphStore implements GraphStore {

    private final LuceneIndex index;

    public LuceneGraphStore(@Qualifier(LuceneConfig.GRAPH_INDEX) final LuceneIndex index) {
        this.index = index;
    }

    @Override
    public void putTriples(final String jobId, final List<Triple> triples) {
        requireNonBlank(jobId);
        try {
            index.update(writer -> {
                // previous triples of this job go first
                writer.deleteDocuments(new Term(FIELD_JOB_ID, jobId));
                for (int i = 0; i < triples.size(); i++) {
                    writer.addDocument(buildLuceneDocument(jobId, i, triples.get(i)));
                }
            });
        } catch (final IOException e) {
            throw new StoreException("Graph write of job " + jobId + " failed", e);
        }
        log.debug("Wrote {} triples for job {}", triples.size(), jobId);
    }

    @Override
    public List<Triple> listTriples(final String jobId) {
        requireNonBlank(jobId);
        final SearcherManager searcherManager = index.searcherManager();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TermQuery query = new TermQuery(new Term(FIELD_JOB_ID, jobId));
                final int total = searcher.count(query);
                if (total == 0) {
                    return List.of();
                }

                final TopDocs topDocs = searcher.search(query, total,
                        new Sort(new SortField(FIELD_ORDINAL, SortField.Type.LONG)));
                final StoredFields storedFields = searcher.storedFields();
                final List<Triple> triples = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final Document doc = storedFields.document(sd.doc);
                    triples.add(new Triple(doc.get(FIELD_SUBJECT), doc.get(FIELD_PREDICATE), doc.get(FIELD_OBJECT)));
                }
                return triples;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StoreException("Graph read of job " + jobId + " failed", e);
        }
    }

    @Override
    public void deleteByJobId(final String jobId) {
        requireNonBlank(jobId);
        try {
            index.update(writer -> writer.deleteDocuments(new Term(FIELD_JOB_ID, jobId)));
        } catch (final IOException e) {
            throw new StoreException("Graph delete of job " + jobId + " failed", e);
        }
    }

    private Document buildLuceneDocument(final String jobId, final int ordinal, final Triple t) {
        final Document d = new Document();
        d.add(new StringField(FIELD_TRIPLE_ID, tripleId(jobId, t), Field.Store.YES));
        d.add(new StringField(FIELD_JOB_ID, jobId, Field.Store.YES));
        d.add(new StringField(FIELD_SUBJECT, t.subject(), Field.Store.YES));
        d.add(new StringField(FIELD_PREDICATE, t.predicate(), Field.Store.YES));
        d.add(new StoredField(FIELD_OBJECT, t.object()));
        d.add(new NumericDocValuesField(FIELD_ORDINAL, ordinal));
        return d;
    }

    /**
     * Deterministic id, identical for the same statement within the same job.
     */
    static String tripleId(final String jobId, final Triple t) {
        final String key = jobId + '\u0000' + t.subject() + '\u0000' + t.predicate() + '\u0000' + t.object();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static void requireNonBlank(final String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
    }
}
