package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.catalog.EJobState;
import eu.virtualparadox.knowledge.catalog.entity.JobEntity;
import eu.virtualparadox.knowledge.catalog.service.JobCatalogService;
import eu.virtualparadox.knowledge.ingest.error.DegradedIngestionException;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.IngestionException;
import eu.virtualparadox.knowledge.ingest.error.JobCancelledException;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.pipeline.Pipeline;
import eu.virtualparadox.knowledge.ingest.pipeline.PipelineFactory;
import eu.virtualparadox.knowledge.ingest.pipeline.PipelineResult;
import eu.virtualparadox.knowledge.ingest.source.ContentSource;
import eu.virtualparadox.knowledge.ingest.source.ContentSourceResolver;
import eu.virtualparadox.knowledge.ingest.source.SourceContent;
import eu.virtualparadox.knowledge.ingest.source.TranscriptionClient;
import eu.virtualparadox.knowledge.ingest.source.TranscriptionStatus;
import eu.virtualparadox.knowledge.rag.graph.GraphSource;
import eu.virtualparadox.knowledge.queue.TaskContext;
import eu.virtualparadox.knowledge.queue.TaskQueue;
import eu.virtualparadox.knowledge.util.RetryPolicy;
import eu.virtualparadox.knowledge.util.RetrySupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Drives a job through its state machine, one queue task at a time.
 * <pre>
 * SUBMITTED → (EXTERNAL_PENDING ⇄ EXTERNAL_POLLING)? → CONTENT_READY → PROCESSING → WRITING → INDEXED | INDEXED_DEGRADED
 * </pre>
 * <p>
 * Every handler first checks that the job is in the state its task expects, so a duplicate
 * delivery does nothing. A state change and the task it schedules commit together. Nothing is
 * kept in memory between tasks: content, counters and provenance live on the job record.
 * </p>
 * <p>
 * Errors end here. Ingestion errors and cancellation become terminal states with a stable
 * reason. Anything unexpected is handed back to the queue for another delivery, and recorded
 * as {@code internal_error} on the last one.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCoordinator {

    private static final Set<EJobState> SUBMITTED = EnumSet.of(EJobState.SUBMITTED);
    private static final Set<EJobState> EXTERNAL_POLLING = EnumSet.of(EJobState.EXTERNAL_POLLING);
    private static final Set<EJobState> PROCESSING = EnumSet.of(EJobState.PROCESSING);
    private static final Set<EJobState> WRITING = EnumSet.of(EJobState.WRITING);

    private final JobCatalogService catalog;
    private final TaskQueue queue;
    private final ContentSourceResolver sourceResolver;
    private final TranscriptionClient transcriptionClient;
    private final PipelineFactory pipelineFactory;
    private final WriteCoordinator writeCoordinator;
    private final PollSchedule pollSchedule;
    private final IngestionProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public void start(final String jobId, final TaskContext context) {
        guarded(jobId, context, () -> doStart(jobId));
    }

    public void poll(final String jobId, final TaskContext context) {
        guarded(jobId, context, () -> doPoll(jobId, context));
    }

    public void process(final String jobId, final TaskContext context) {
        guarded(jobId, context, () -> doProcess(jobId, context));
    }

    public void reindex(final String jobId, final TaskContext context) {
        guarded(jobId, context, () -> doReindex(jobId));
    }

    /**
     * Last resort for a task whose worker vanished on its final attempt.
     */
    public void abandon(final String jobId) {
        catalog.fail(jobId, EFailureReason.INTERNAL_ERROR, "Task abandoned by its worker");
    }

    private void guarded(final String jobId, final TaskContext context, final Runnable body) {
        try {
            body.run();
        } catch (final JobCancelledException e) {
            log.info("Job {} cancelled", jobId);
            catalog.markCancelled(jobId);
        } catch (final IngestionException e) {
            log.warn("Job {} failed: {} ({})", jobId, e.getMessage(), e.getReason().code());
            catalog.fail(jobId, e.getReason(), e.getMessage());
        } catch (final RuntimeException e) {
            if (!context.isLastAttempt()) {
                throw e;
            }
            log.error("Job {} failed with an unexpected error on the last attempt", jobId, e);
            catalog.fail(jobId, EFailureReason.INTERNAL_ERROR, "Unexpected error: " + e);
        }
    }

    private void doStart(final String jobId) {
        final Optional<JobEntity> found = catalog.find(jobId);
        if (found.isEmpty() || found.get().getState() != EJobState.SUBMITTED) {
            log.debug("Job {} is not SUBMITTED, start skipped", jobId);
            return;
        }
        final JobEntity job = found.get();
        checkCancelled(job);

        final ContentSource source = sourceResolver.resolve(job.getSourceRef());
        final RetryPolicy sourceRetry = properties.getSourceRetry().toPolicy();

        if (source.requiresTranscription()) {
            final String ref = source.transcriptionRef(job.getSourceRef());
            final String externalJobId = RetrySupport.executeWithRetry(
                    () -> transcriptionClient.submitJob(ref), "Transcription submit of job " + jobId, sourceRetry);
            final Instant now = clock.instant();
            final Instant firstPoll = pollSchedule.nextPollAt(now, now, 0);
            transitionAndEnqueue(jobId, SUBMITTED, j -> {
                j.setState(EJobState.EXTERNAL_PENDING);
                j.setExternalJobId(externalJobId);
                j.setExternalSubmittedAt(now);
                j.setPollCount(0);
            }, IngestionTasks.POLL, firstPoll);
            return;
        }

        log.info("Job {}: fetching {} through {} source", jobId, job.getSourceRef(), source.name());
        final SourceContent content = RetrySupport.executeWithRetry(
                () -> source.fetch(job.getSourceRef()), "Fetch of job " + jobId, sourceRetry);
        contentReady(jobId, SUBMITTED, content);
    }

    private void doPoll(final String jobId, final TaskContext context) {
        final Optional<JobEntity> found = catalog.find(jobId);
        if (found.isEmpty()) {
            return;
        }
        // a redelivery may find the job still marked as polling by a worker that died
        final Set<EJobState> expected = context.attempt() > 1
                ? EnumSet.of(EJobState.EXTERNAL_PENDING, EJobState.EXTERNAL_POLLING)
                : EnumSet.of(EJobState.EXTERNAL_PENDING);
        if (!expected.contains(found.get().getState())) {
            log.debug("Job {} is {}, poll skipped", jobId, found.get().getState());
            return;
        }
        checkCancelled(found.get());

        final Optional<JobEntity> polling = catalog.transition(jobId, expected, j -> {
            j.setState(EJobState.EXTERNAL_POLLING);
            j.setPollCount(j.getPollCount() + 1);
        });
        if (polling.isEmpty()) {
            return;
        }
        final JobEntity job = polling.get();

        TranscriptionStatus status;
        try {
            status = transcriptionClient.poll(job.getExternalJobId());
        } catch (final IngestionException e) {
            if (!e.isTransient()) {
                throw new PermanentIngestionException(EFailureReason.EXTERNAL_JOB_FAILED, e.getMessage(), e);
            }
            log.warn("Job {}: poll {} of external job {} failed, treating as pending: {}",
                    jobId, job.getPollCount(), job.getExternalJobId(), e.getMessage());
            status = TranscriptionStatus.pending();
        }

        // results of an in-flight poll are discarded once cancellation was requested
        if (catalog.isCancelRequested(jobId)) {
            throw new JobCancelledException(jobId);
        }

        switch (status.state()) {
            case READY -> {
                log.info("Job {}: external job {} ready after {} polls", jobId, job.getExternalJobId(), job.getPollCount());
                contentReady(jobId, EXTERNAL_POLLING, SourceContent.plain(status.text()));
            }
            case FAILED -> throw new PermanentIngestionException(EFailureReason.EXTERNAL_JOB_FAILED,
                    "External job " + job.getExternalJobId() + " failed: " + status.error());
            case PENDING -> schedulePoll(job);
        }
    }

    private void schedulePoll(final JobEntity job) {
        final Instant now = clock.instant();
        final Instant submittedAt = job.getExternalSubmittedAt();
        if (pollSchedule.isExpired(submittedAt, now)) {
            throw new PermanentIngestionException(EFailureReason.EXTERNAL_JOB_TIMEOUT,
                    "External job " + job.getExternalJobId() + " not ready after " + job.getPollCount()
                            + " polls, giving up at " + pollSchedule.deadline(submittedAt));
        }
        final Instant next = pollSchedule.nextPollAt(submittedAt, now, job.getPollCount());
        log.debug("Job {}: external job pending, next poll at {}", job.getId(), next);
        transitionAndEnqueue(job.getId(), EXTERNAL_POLLING,
                j -> j.setState(EJobState.EXTERNAL_PENDING), IngestionTasks.POLL, next);
    }

    private void doProcess(final String jobId, final TaskContext context) {
        final Optional<JobEntity> found = catalog.find(jobId);
        if (found.isEmpty()) {
            return;
        }
        final EJobState state = found.get().getState();
        final boolean redelivery = context.attempt() > 1;

        if (state == EJobState.WRITING && redelivery) {
            log.info("Job {}: resuming interrupted write from staged artifacts", jobId);
            finishWriting(jobId, () -> writeCoordinator.replay(graphSource(found.get())));
            return;
        }
        if (state != EJobState.CONTENT_READY && !(state == EJobState.PROCESSING && redelivery)) {
            log.debug("Job {} is {}, process skipped", jobId, state);
            return;
        }
        checkCancelled(found.get());

        final Optional<JobEntity> processing = catalog.transition(jobId,
                EnumSet.of(EJobState.CONTENT_READY, EJobState.PROCESSING), j -> {
                    j.setState(EJobState.PROCESSING);
                    j.setAttemptCount(j.getAttemptCount() + 1);
                });
        if (processing.isEmpty()) {
            return;
        }
        final JobEntity job = processing.get();

        final Pipeline pipeline = pipelineFactory.create(job.getOptions());
        final PipelineResult result = pipeline.run(jobId, job.getContentText(), job.getSectionStarts(),
                () -> catalog.isCancelRequested(jobId));

        // last cancellation checkpoint, atomic with entering WRITING
        final Optional<JobEntity> writing = catalog.transition(jobId, PROCESSING, j -> {
            if (j.isCancelRequested()) {
                j.setState(EJobState.CANCELLED);
                j.setLastError("Cancelled on request");
                return;
            }
            j.setState(EJobState.WRITING);
            j.setChunkCount(result.chunks().size());
            j.setConceptCount(result.concepts().size());
            j.setEmbeddingModelVersion(result.embeddingModelVersion());
            j.setProvenance(result.provenance());
        });
        if (writing.isEmpty() || writing.get().getState() != EJobState.WRITING) {
            log.info("Job {}: not writing results, job is {}", jobId,
                    writing.map(JobEntity::getState).orElse(null));
            return;
        }

        finishWriting(jobId, () -> writeCoordinator.write(graphSource(job), result));
    }

    private void doReindex(final String jobId) {
        final Optional<JobEntity> found = catalog.find(jobId);
        if (found.isEmpty() || found.get().getState() != EJobState.WRITING) {
            log.debug("Job {} is not WRITING, re-index skipped", jobId);
            return;
        }
        finishWriting(jobId, () -> writeCoordinator.replay(graphSource(found.get())));
    }

    private GraphSource graphSource(final JobEntity job) {
        return new GraphSource(job.getId(), job.getSourceRef(), sourceResolver.resolve(job.getSourceRef()).name());
    }

    private void finishWriting(final String jobId, final Runnable write) {
        try {
            write.run();
        } catch (final DegradedIngestionException e) {
            catalog.transition(jobId, WRITING, j -> {
                j.setState(EJobState.INDEXED_DEGRADED);
                j.setFailureReason(e.getReason());
                j.setLastError(e.getMessage());
            });
            return;
        }
        catalog.transition(jobId, WRITING, j -> {
            j.setState(EJobState.INDEXED);
            j.setFailureReason(null);
            j.setLastError(null);
        });
    }

    private void contentReady(final String jobId, final Set<EJobState> from, final SourceContent content) {
        final List<Integer> sections = content.sectionStarts();
        transitionAndEnqueue(jobId, from, j -> {
            j.setState(EJobState.CONTENT_READY);
            j.setContentText(content.text());
            j.setSectionStarts(sections);
        }, IngestionTasks.PROCESS, null);
    }

    /**
     * Applies the transition and schedules the follow-up task in one transaction.
     */
    private void transitionAndEnqueue(final String jobId,
                                      final Set<EJobState> from,
                                      final Consumer<JobEntity> mutation,
                                      final String nextTask,
                                      final Instant eta) {
        transactionTemplate.executeWithoutResult(status -> catalog.transition(jobId, from, mutation)
                .ifPresent(job -> queue.enqueue(nextTask, IngestionTasks.payload(jobId), eta)));
    }

    private static void checkCancelled(final JobEntity job) {
        if (job.isCancelRequested()) {
            throw new JobCancelledException(job.getId());
        }
    }
}
