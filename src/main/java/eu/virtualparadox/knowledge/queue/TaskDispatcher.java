package eu.virtualparadox.knowledge.queue;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.application.executor.IngestionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feeds due tasks from the {@link TaskQueue} to the ingestion worker pool.
 * <p>
 * Only as many tasks are claimed as the pool can take right now, so a claimed task is never
 * stuck behind a busy executor until its claim expires.
 * </p>
 * <p>
 * Tasks that are running renew their claim on every heartbeat. A long job therefore keeps its
 * task for as long as its worker lives, and only a dead worker's task is delivered again.
 * </p>
 */
@Slf4j
@Component
public class TaskDispatcher {

    private final TaskQueue queue;
    private final Map<String, TaskHandler> handlers = new HashMap<>();
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final IngestionExecutor executor;
    private final int batchSize;

    public TaskDispatcher(final TaskQueue queue,
                          final List<TaskHandler> handlers,
                          final IngestionExecutor executor,
                          final IngestionProperties properties) {
        this.queue = queue;
        this.executor = executor;
        this.batchSize = properties.getQueue().getBatchSize();
        final Duration heartbeat = Duration.ofMillis(properties.getQueue().getHeartbeatIntervalMs());
        final Duration visibility = properties.getQueue().getVisibilityTimeout();
        if (heartbeat.isZero() || heartbeat.isNegative() || heartbeat.multipliedBy(2).compareTo(visibility) > 0) {
            throw new IllegalStateException("Claim heartbeat " + heartbeat
                    + " must be positive and fit twice into the visibility timeout " + visibility);
        }
        for (final TaskHandler handler : handlers) {
            if (this.handlers.put(handler.taskName(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for task " + handler.taskName());
            }
        }
        log.info("Task dispatcher ready for {}", this.handlers.keySet());
    }

    @Scheduled(fixedDelayString = "${knowledge.ingestion.queue.poll-interval-ms:1000}")
    public void dispatch() {
        buryAbandoned();

        final int free = freeCapacity();
        if (free <= 0) {
            return;
        }

        for (final QueuedTask task : queue.claimDue(Math.min(free, batchSize))) {
            try {
                executor.execute(() -> run(task));
            } catch (final TaskRejectedException e) {
                log.warn("Executor full, releasing task {} ({})", task.id(), task.name());
                queue.release(task.id());
            }
        }
    }

    /**
     * Runs every task that is due now on the calling thread, until none is left.
     *
     * @return number of deliveries made
     */
    public int runDueTasks() {
        int delivered = 0;
        buryAbandoned();
        List<QueuedTask> due = queue.claimDue(batchSize);
        while (!due.isEmpty()) {
            for (final QueuedTask task : due) {
                run(task);
                delivered++;
            }
            due = queue.claimDue(batchSize);
        }
        return delivered;
    }

    /**
     * Renews the claims of every task running in this process.
     *
     * @return number of claims renewed
     */
    @Scheduled(fixedDelayString = "${knowledge.ingestion.queue.heartbeat-interval-ms:60000}")
    public int renewClaims() {
        if (running.isEmpty()) {
            return 0;
        }
        final Set<String> snapshot = Set.copyOf(running);
        final int renewed = queue.renewClaims(snapshot);
        if (renewed < snapshot.size()) {
            log.debug("Renewed {} of {} running claims, the rest finished meanwhile", renewed, snapshot.size());
        }
        return renewed;
    }

    @Scheduled(cron = "${knowledge.ingestion.queue.purge-cron:0 30 3 * * *}")
    public void purge() {
        queue.purgeCompleted();
    }

    void run(final QueuedTask task) {
        final TaskHandler handler = handlers.get(task.name());
        if (handler == null) {
            log.error("No handler for task {} ({})", task.id(), task.name());
            queue.fail(task.id(), "No handler for task " + task.name());
            return;
        }

        log.debug("Running task {} ({}) attempt {}/{}", task.id(), task.name(), task.attempt(), task.maxAttempts());
        running.add(task.id());
        try {
            handler.handle(task.payload(), task.context());
        } catch (final RuntimeException e) {
            log.warn("Task {} ({}) failed on attempt {}", task.id(), task.name(), task.attempt(), e);
            queue.fail(task.id(), e.getClass().getSimpleName() + ": " + e.getMessage());
            return;
        } finally {
            running.remove(task.id());
        }
        queue.complete(task.id());
    }

    private void buryAbandoned() {
        for (final QueuedTask task : queue.buryAbandoned()) {
            final TaskHandler handler = handlers.get(task.name());
            if (handler == null) {
                continue;
            }
            try {
                handler.onAbandoned(task.payload());
            } catch (final RuntimeException e) {
                log.error("Abandon hook of task {} ({}) failed", task.id(), task.name(), e);
            }
        }
    }

    private int freeCapacity() {
        return executor.getMaxPoolSize() + executor.getQueueCapacity()
                - executor.getActiveCount() - executor.getQueueSize();
    }
}
