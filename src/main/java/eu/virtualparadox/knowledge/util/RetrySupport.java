package eu.virtualparadox.knowledge.util;

import eu.virtualparadox.knowledge.ingest.error.IngestionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry utility for transient failures.
 * <p>
 * Runs an operation up to {@link RetryPolicy#maxAttempts()} times with exponential backoff.
 * Only failures the classifier considers transient are retried; anything else is rethrown
 * immediately. When all attempts are used the last failure is rethrown unchanged.
 * </p>
 */
@Slf4j
public final class RetrySupport {

    private RetrySupport() {
        // prevent instantiation
    }

    /**
     * Default classifier: only {@link IngestionException}s flagged transient are retried.
     */
    public static boolean isTransient(final RuntimeException e) {
        return e instanceof IngestionException ie && ie.isTransient();
    }

    public static <T> T executeWithRetry(final Supplier<T> operation,
                                         final String operationName,
                                         final RetryPolicy policy) {
        return executeWithRetry(operation, operationName, policy, RetrySupport::isTransient);
    }

    /**
     * Executes a supplier with retry for transient failures.
     *
     * @param operation     the operation to execute
     * @param operationName name for logging purposes
     * @param policy        attempt limit and backoff
     * @param transientTest decides whether a failure is worth another attempt
     * @param <T>           return type
     * @return the result of the first successful attempt
     * @throws RuntimeException the last failure if attempts are exhausted, or the first non-transient one
     */
    public static <T> T executeWithRetry(final Supplier<T> operation,
                                         final String operationName,
                                         final RetryPolicy policy,
                                         final Predicate<RuntimeException> transientTest) {
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return operation.get();
            } catch (final RuntimeException exception) {
                lastException = exception;

                if (!transientTest.test(exception)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, policy.maxAttempts());
                    throw exception;
                }

                if (attempt < policy.maxAttempts()) {
                    final Duration backoff = policy.backoffAfter(attempt);
                    log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms: {}",
                            operationName, attempt, policy.maxAttempts(), backoff.toMillis(), exception.getMessage());
                    sleep(backoff);
                } else {
                    log.error("{} failed after {} attempts, giving up", operationName, policy.maxAttempts());
                }
            }
        }

        throw lastException;
    }

    /**
     * Executes a runnable with retry for transient failures.
     */
    public static void executeWithRetry(final Runnable operation,
                                        final String operationName,
                                        final RetryPolicy policy,
                                        final Predicate<RuntimeException> transientTest) {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, operationName, policy, transientTest);
    }

    private static void sleep(final Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (final InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
