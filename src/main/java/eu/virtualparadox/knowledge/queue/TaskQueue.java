package eu.virtualparadox.knowledge.queue;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable at-least-once task queue.
 * <p>
 * A claimed task is either completed, failed (and then retried later or given up) or released.
 * A claim that is never resolved expires and the task is delivered again, unless its worker
 * keeps renewing it.
 * </p>
 */
public interface TaskQueue {

    /**
     * @param eta earliest time to run, {@code null} for now
     * @return id of the new task
     */
    String enqueue(String taskName, Map<String, String> payload, Instant eta);

    /**
     * Claims up to {@code max} due tasks for this worker.
     */
    List<QueuedTask> claimDue(int max);

    /**
     * Extends the claims of tasks that are still running, so they are not delivered again while
     * their worker is alive. Ids of tasks no longer claimed are ignored.
     *
     * @return number of claims renewed
     */
    int renewClaims(Collection<String> taskIds);

    void complete(String taskId);

    /**
     * Records a failed delivery. The task runs again after a backoff unless it has no attempts left.
     */
    void fail(String taskId, String error);

    /**
     * Returns a claimed task that was never started, without counting the delivery.
     */
    void release(String taskId);

    /**
     * Gives up tasks whose owner vanished during their last attempt.
     *
     * @return the tasks given up
     */
    List<QueuedTask> buryAbandoned();

    /**
     * @return number of completed tasks removed
     */
    int purgeCompleted();
}
