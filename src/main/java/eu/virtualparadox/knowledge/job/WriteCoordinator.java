package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.catalog.service.DocumentStore;
import eu.virtualparadox.knowledge.catalog.service.StoredChunk;
import eu.virtualparadox.knowledge.ingest.error.DegradedIngestionException;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.StoreException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.Embedding;
import eu.virtualparadox.knowledge.ingest.pipeline.PipelineResult;
import eu.virtualparadox.knowledge.rag.graph.ConceptTripleMapper;
import eu.virtualparadox.knowledge.rag.graph.GraphSource;
import eu.virtualparadox.knowledge.rag.graph.GraphStore;
import eu.virtualparadox.knowledge.rag.graph.Triple;
import eu.virtualparadox.knowledge.rag.index.VectorRecord;
import eu.virtualparadox.knowledge.rag.index.VectorStore;
import eu.virtualparadox.knowledge.util.RetryPolicy;
import eu.virtualparadox.knowledge.util.RetrySupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persists a job's artifacts across the three stores, which share no transaction.
 * <p>
 * The order is fixed: DocumentStore, then VectorStore, then GraphStore.
 * <ul>
 *   <li>DocumentStore failure: nothing else is written, {@code write_documents_failed}.</li>
 *   <li>VectorStore failure after retries: chunks stay with {@code indexed=false},
 *       {@code write_vectors_failed}.</li>
 *   <li>GraphStore failure after retries: retrieval still works, so the job is only degraded,
 *       {@code write_graph_failed}.</li>
 * </ul>
 * Re-indexing replays the vector and graph writes from the staged chunk rows. The graph holds
 * the source, its chunks and their concepts, and is only written when there are concepts.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WriteCoordinator {

    private final DocumentStore documentStore;
    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final ConceptTripleMapper tripleMapper;
    private final IngestionProperties properties;

    /**
     * Writes freshly computed artifacts.
     *
     * @throws PermanentIngestionException if the document or vector write fails
     * @throws DegradedIngestionException  if only the graph write fails
     */
    public void write(final GraphSource source, final PipelineResult result) {
        final String jobId = source.jobId();
        final List<StoredChunk> staged = stage(result);
        try {
            documentStore.putChunks(jobId, staged);
        } catch (final StoreException e) {
            log.error("Job {}: document write failed, nothing else written", jobId, e);
            throw new PermanentIngestionException(EFailureReason.WRITE_DOCUMENTS_FAILED,
                    "Writing chunks failed: " + rootMessage(e), e);
        }
        writeIndexes(source, staged);
    }

    /**
     * Replays the vector and graph writes from the DocumentStore, without recomputing anything.
     */
    public void replay(final GraphSource source) {
        final String jobId = source.jobId();
        final List<StoredChunk> staged;
        try {
            staged = documentStore.listChunks(jobId);
        } catch (final StoreException e) {
            throw new PermanentIngestionException(EFailureReason.WRITE_DOCUMENTS_FAILED,
                    "Reading staged chunks failed: " + rootMessage(e), e);
        }
        if (staged.isEmpty()) {
            throw new PermanentIngestionException(EFailureReason.WRITE_DOCUMENTS_FAILED,
                    "No staged chunks to re-index for job " + jobId);
        }
        for (final StoredChunk chunk : staged) {
            if (chunk.embedding() == null) {
                throw new PermanentIngestionException(EFailureReason.WRITE_VECTORS_FAILED,
                        "Chunk " + chunk.chunk().id() + " has no staged embedding");
            }
        }
        log.info("Job {}: replaying index writes for {} chunks", jobId, staged.size());
        writeIndexes(source, staged);
    }

    private void writeIndexes(final GraphSource source, final List<StoredChunk> staged) {
        final String jobId = source.jobId();
        final RetryPolicy retry = properties.getWriteRetry().toPolicy();

        final List<VectorRecord> records = new ArrayList<>(staged.size());
        final List<Concept> concepts = new ArrayList<>();
        for (final StoredChunk stored : staged) {
            final Embedding embedding = stored.embedding();
            records.add(new VectorRecord(stored.chunk().id(), jobId, embedding.vector(), embedding.modelVersion(),
                    Map.of("sequenceIndex", Integer.toString(stored.chunk().sequenceIndex()))));
            concepts.addAll(stored.concepts());
        }

        try {
            RetrySupport.executeWithRetry(() -> vectorStore.upsertAll(records),
                    "Vector write of job " + jobId, retry, e -> true);
        } catch (final RuntimeException e) {
            log.error("Job {}: vector write failed, chunks stay unindexed", jobId, e);
            markUnindexed(jobId);
            throw new PermanentIngestionException(EFailureReason.WRITE_VECTORS_FAILED,
                    "Writing vectors failed: " + rootMessage(e), e);
        }

        DegradedIngestionException degraded = null;
        if (concepts.isEmpty()) {
            log.debug("Job {}: no concepts, graph write skipped", jobId);
        } else {
            final List<Triple> triples = tripleMapper.toTriples(source, staged);
            try {
                RetrySupport.executeWithRetry(() -> graphStore.putTriples(jobId, triples),
                        "Graph write of job " + jobId, retry, e -> true);
            } catch (final RuntimeException e) {
                log.error("Job {}: graph write failed, job will be degraded", jobId, e);
                degraded = new DegradedIngestionException(EFailureReason.WRITE_GRAPH_FAILED,
                        "Writing concept graph failed: " + rootMessage(e), e);
            }
        }

        try {
            documentStore.markIndexed(jobId, true);
        } catch (final StoreException e) {
            throw new PermanentIngestionException(EFailureReason.WRITE_DOCUMENTS_FAILED,
                    "Marking chunks indexed failed: " + rootMessage(e), e);
        }

        if (degraded != null) {
            throw degraded;
        }
        log.info("Job {}: {} vectors and {} concepts written", jobId, records.size(), concepts.size());
    }

    private void markUnindexed(final String jobId) {
        try {
            documentStore.markIndexed(jobId, false);
        } catch (final StoreException e) {
            log.error("Job {}: could not mark chunks unindexed", jobId, e);
        }
    }

    private static List<StoredChunk> stage(final PipelineResult result) {
        final Map<String, List<Concept>> conceptsByChunk = result.conceptsByChunk();
        final List<StoredChunk> staged = new ArrayList<>(result.chunks().size());
        for (int i = 0; i < result.chunks().size(); i++) {
            final Chunk chunk = result.chunks().get(i);
            staged.add(new StoredChunk(chunk, result.embeddings().get(i),
                    conceptsByChunk.getOrDefault(chunk.id(), List.of()), false));
        }
        return staged;
    }

    private static String rootMessage(final Throwable e) {
        final Throwable root = ExceptionUtils.getRootCause(e);
        return StringUtils.defaultIfBlank(root.getMessage(), root.getClass().getSimpleName());
    }
}
