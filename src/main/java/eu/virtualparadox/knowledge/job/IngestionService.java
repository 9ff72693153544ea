package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.catalog.EJobState;
import eu.virtualparadox.knowledge.catalog.entity.JobEntity;
import eu.virtualparadox.knowledge.catalog.service.DocumentStore;
import eu.virtualparadox.knowledge.catalog.service.JobCatalogService;
import eu.virtualparadox.knowledge.catalog.service.StoredChunk;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;
import eu.virtualparadox.knowledge.rag.graph.GraphStore;
import eu.virtualparadox.knowledge.queue.TaskQueue;
import eu.virtualparadox.knowledge.rag.index.VectorStore;
import eu.virtualparadox.knowledge.util.RetryPolicy;
import eu.virtualparadox.knowledge.util.RetrySupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for the layer above ingestion: submission, inspection and operator actions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private static final String ERROR_NOT_FOUND = "Job not found: ";

    private static final Set<EJobState> TERMINAL =
            EnumSet.of(EJobState.INDEXED, EJobState.INDEXED_DEGRADED, EJobState.FAILED, EJobState.CANCELLED);

    private static final Set<EJobState> REINDEXABLE =
            EnumSet.of(EJobState.INDEXED, EJobState.INDEXED_DEGRADED, EJobState.FAILED);

    private static final Set<EFailureReason> REINDEXABLE_FAILURES =
            EnumSet.of(EFailureReason.WRITE_VECTORS_FAILED, EFailureReason.WRITE_GRAPH_FAILED);

    private final JobCatalogService catalog;
    private final TaskQueue queue;
    private final DocumentStore documentStore;
    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final TransactionTemplate transactionTemplate;

    /**
     * Registers a job for a source. While a non-terminal job exists for the same source and
     * idempotency key, its id is returned instead and nothing new is created.
     *
     * @return id of the new or already running job
     */
    public synchronized String submit(final String sourceRef,
                                      final String idempotencyKey,
                                      final IngestionOptions options) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new IllegalArgumentException("sourceRef must not be blank");
        }
        final String ref = sourceRef.strip();
        final String key = idempotencyKey != null ? idempotencyKey : "";

        final Optional<JobEntity> active = catalog.findActive(ref, key);
        if (active.isPresent()) {
            log.info("Job {} already running for {}, returning it", active.get().getId(), ref);
            return active.get().getId();
        }

        try {
            final String jobId = transactionTemplate.execute(status -> {
                final JobEntity job = catalog.create(ref, key, options);
                queue.enqueue(IngestionTasks.START, IngestionTasks.payload(job.getId()), null);
                return job.getId();
            });
            log.info("Job {} submitted for {}", jobId, ref);
            return jobId;
        } catch (final DataIntegrityViolationException e) {
            // another instance registered the same pair in the meantime
            return catalog.findActive(ref, key).map(JobEntity::getId).orElseThrow(() -> e);
        }
    }

    public Optional<JobView> getJob(final String jobId) {
        return catalog.find(jobId).map(JobView::of);
    }

    /**
     * @return the job's chunks in sequence order, empty until the job reaches WRITING
     */
    public List<Chunk> listChunks(final String jobId) {
        return documentStore.listChunks(jobId).stream()
                .map(StoredChunk::chunk)
                .toList();
    }

    public List<Concept> listConcepts(final String jobId) {
        final List<Concept> concepts = new ArrayList<>();
        for (final StoredChunk chunk : documentStore.listChunks(jobId)) {
            concepts.addAll(chunk.concepts());
        }
        return concepts;
    }

    /**
     * Requests cancellation. It takes effect at the job's next checkpoint; a job that is
     * already writing its results is not interrupted.
     */
    public Optional<JobView> cancel(final String jobId) {
        return RetrySupport.executeWithRetry(() -> catalog.cancel(jobId), "Cancel of job " + jobId,
                        RetryPolicy.immediate(3), e -> e instanceof OptimisticLockingFailureException)
                .map(JobView::of);
    }

    /**
     * Replays the index writes of a finished job from its staged chunks, skipping processing.
     *
     * @throws IllegalArgumentException if the job does not exist
     * @throws IllegalStateException    if the job is not eligible or another job for the same source is running
     */
    public JobView reindex(final String jobId) {
        final JobEntity job = catalog.find(jobId).orElseThrow(() -> new IllegalArgumentException(ERROR_NOT_FOUND + jobId));
        requireReindexable(job);

        final String activeKey = JobCatalogService.activeKey(job.getSourceRef(), job.getIdempotencyKey());
        final Optional<JobEntity> running = catalog.findActive(job.getSourceRef(), job.getIdempotencyKey());
        if (running.isPresent()) {
            throw new IllegalStateException("Job " + running.get().getId() + " is running for the same source");
        }

        try {
            final JobEntity updated = transactionTemplate.execute(status -> catalog.transition(jobId, REINDEXABLE, j -> {
                j.setState(EJobState.WRITING);
                j.setActiveKey(activeKey);
                j.setReindexCount(j.getReindexCount() + 1);
            }).map(j -> {
                queue.enqueue(IngestionTasks.REINDEX, IngestionTasks.payload(jobId), null);
                return j;
            }).orElseThrow(() -> new IllegalStateException("Job " + jobId + " changed state, re-index not started")));
            log.info("Job {}: re-index #{} scheduled", jobId, updated.getReindexCount());
            return JobView.of(updated);
        } catch (final DataIntegrityViolationException e) {
            throw new IllegalStateException("Another job for the same source started, re-index of " + jobId + " refused", e);
        }
    }

    /**
     * Removes a finished job's artifacts from all stores in reverse write order. The job
     * record stays, flagged as purged.
     */
    public JobView purgeArtifacts(final String jobId) {
        final JobEntity job = catalog.find(jobId).orElseThrow(() -> new IllegalArgumentException(ERROR_NOT_FOUND + jobId));
        if (!job.getState().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.getState() + ", only finished jobs can be purged");
        }

        graphStore.deleteByJobId(jobId);
        vectorStore.deleteByJobId(jobId);
        documentStore.deleteByJobId(jobId);

        final JobEntity purged = catalog.transition(jobId, TERMINAL, j -> j.setArtifactsPurged(true))
                .orElseThrow(() -> new IllegalStateException("Job " + jobId + " changed state during purge"));
        log.info("Job {}: artifacts purged from all stores", jobId);
        return JobView.of(purged);
    }

    private void requireReindexable(final JobEntity job) {
        final String id = job.getId();
        if (!REINDEXABLE.contains(job.getState())) {
            throw new IllegalStateException("Job " + id + " is " + job.getState() + " and cannot be re-indexed");
        }
        if (job.getState() == EJobState.FAILED && !REINDEXABLE_FAILURES.contains(job.getFailureReason())) {
            throw new IllegalStateException("Job " + id + " failed before its chunks were written");
        }
        if (job.isArtifactsPurged()) {
            throw new IllegalStateException("Artifacts of job " + id + " were purged");
        }
        if (documentStore.listChunks(id).isEmpty()) {
            throw new IllegalStateException("Job " + id + " has no staged chunks");
        }
    }
}
