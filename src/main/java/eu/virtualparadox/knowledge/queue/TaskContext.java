package eu.virtualparadox.knowledge.queue;

/**
 * Delivery details visible to a task body.
 *
 * @param taskId      queue entry id
 * @param attempt     1-based delivery number
 * @param maxAttempts deliveries allowed before the task is given up
 */
public record TaskContext(String taskId, int attempt, int maxAttempts) {

    /**
     * @return {@code true} if a failure now will not be retried
     */
    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }
}
