package eu.virtualparadox.knowledge.ingest.pipeline;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.IngestionException;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import eu.virtualparadox.knowledge.util.RetryPolicy;
import eu.virtualparadox.knowledge.util.RetrySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToIntFunction;

/**
 * Runs a single {@link Processor} with a timeout and bounded retry.
 * <p>
 * Each attempt runs on the pipeline executor. A timed-out attempt counts as a transient failure.
 * Processor errors are reclassified here: unknown runtime errors become permanent, and transient
 * errors left over after the last attempt become {@code processing_retries_exhausted}.
 * </p>
 */
@Slf4j
public class StageRunner {

    private final AsyncTaskExecutor executor;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public StageRunner(final AsyncTaskExecutor executor,
                       final Duration timeout,
                       final RetryPolicy retryPolicy,
                       final Clock clock) {
        this.executor = executor;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * Result of a stage together with its provenance record.
     */
    public record StageResult<O>(O output, StageProvenance provenance) {
    }

    public <I, O> StageResult<O> run(final String jobId,
                                     final Processor<I, O> processor,
                                     final I input,
                                     final ToIntFunction<O> outputCount,
                                     final String detail) {
        final String stage = processor.name();
        final Instant startedAt = clock.instant();
        final AtomicInteger attempts = new AtomicInteger();

        final O output;
        try {
            output = RetrySupport.executeWithRetry(() -> {
                attempts.incrementAndGet();
                return runOnce(jobId, processor, input);
            }, "Stage " + stage + " of job " + jobId, retryPolicy);
        } catch (final TransientIngestionException e) {
            throw new PermanentIngestionException(EFailureReason.PROCESSING_RETRIES_EXHAUSTED,
                    "Stage " + stage + " failed after " + attempts.get() + " attempts: " + e.getMessage(), e);
        }

        final StageProvenance provenance = new StageProvenance(
                stage, attempts.get(), startedAt, clock.instant(), outputCount.applyAsInt(output), detail);
        log.info("Job {}: stage {} produced {} items in {} attempt(s)",
                jobId, stage, provenance.outputCount(), provenance.attempts());
        return new StageResult<>(output, provenance);
    }

    private <I, O> O runOnce(final String jobId, final Processor<I, O> processor, final I input) {
        final Future<O> future = executor.submit(() -> processor.process(input));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            throw new TransientIngestionException(EFailureReason.PROCESSING_FAILED,
                    "Stage " + processor.name() + " of job " + jobId + " timed out after " + timeout, e);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientIngestionException(EFailureReason.PROCESSING_FAILED,
                    "Interrupted while waiting for stage " + processor.name(), e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IngestionException ingestion) {
                throw ingestion;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PermanentIngestionException(EFailureReason.PROCESSING_FAILED,
                    "Stage " + processor.name() + " failed: " + cause.getMessage(), cause);
        }
    }
}
