package eu.virtualparadox.knowledge.ingest.pipeline;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import eu.virtualparadox.knowledge.util.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class StageRunnerTest {

    private final SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("stage-test-");

    private static <I, O> Processor<I, O> processor(Function<I, O> body) {
        return new Processor<>() {
            @Override
            public String name() {
                return "test";
            }

            @Override
            public O process(I input) {
                return body.apply(input);
            }
        };
    }

    private StageRunner runner(Duration timeout, RetryPolicy policy) {
        return new StageRunner(executor, timeout, policy, Clock.systemUTC());
    }

    @Test
    @DisplayName("Transient failures are retried and counted in the provenance")
    void retriesTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        Processor<String, String> flaky = processor(in -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientIngestionException(EFailureReason.PROCESSING_FAILED, "not yet");
            }
            return in.toUpperCase();
        });

        StageRunner.StageResult<String> result = runner(Duration.ofSeconds(5), RetryPolicy.immediate(3))
                .run("job", flaky, "abc", String::length, "detail");

        assertEquals("ABC", result.output());
        assertEquals("test", result.provenance().stage());
        assertEquals(3, result.provenance().attempts());
        assertEquals(3, result.provenance().outputCount());
        assertEquals("detail", result.provenance().detail());
        assertFalse(result.provenance().finishedAt().isBefore(result.provenance().startedAt()));
    }

    @Test
    @DisplayName("Transient failures left after the last attempt become processing_retries_exhausted")
    void exhaustsRetries() {
        Processor<String, String> broken = processor(in -> {
            throw new TransientIngestionException(EFailureReason.PROCESSING_FAILED, "always busy");
        });

        PermanentIngestionException e = assertThrows(PermanentIngestionException.class,
                () -> runner(Duration.ofSeconds(5), RetryPolicy.immediate(2)).run("job", broken, "x", String::length, ""));
        assertEquals(EFailureReason.PROCESSING_RETRIES_EXHAUSTED, e.getReason());
    }

    @Test
    @DisplayName("Unexpected errors are permanent and not retried")
    void unexpectedErrorIsPermanent() {
        AtomicInteger calls = new AtomicInteger();
        Processor<String, String> buggy = processor(in -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        });

        PermanentIngestionException e = assertThrows(PermanentIngestionException.class,
                () -> runner(Duration.ofSeconds(5), RetryPolicy.immediate(3)).run("job", buggy, "x", String::length, ""));
        assertEquals(EFailureReason.PROCESSING_FAILED, e.getReason());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A stage exceeding its timeout fails once retries are used up")
    void timeout() {
        Processor<String, String> slow = processor(in -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return in;
        });

        PermanentIngestionException e = assertThrows(PermanentIngestionException.class,
                () -> runner(Duration.ofMillis(100), RetryPolicy.none()).run("job", slow, "x", String::length, ""));
        assertEquals(EFailureReason.PROCESSING_RETRIES_EXHAUSTED, e.getReason());
    }
}
