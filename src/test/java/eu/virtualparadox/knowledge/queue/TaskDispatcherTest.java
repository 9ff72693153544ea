package eu.virtualparadox.knowledge.queue;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.application.executor.IngestionExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TaskDispatcherTest {

    private RecordingQueue queue;
    private IngestionExecutor executor;
    private IngestionProperties properties;

    @BeforeEach
    void setUp() {
        queue = new RecordingQueue();
        executor = new IngestionExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("dispatch-test-");
        executor.initialize();
        properties = new IngestionProperties();
        properties.getQueue().setBatchSize(16);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Successful handlers complete their task")
    void successCompletes() {
        final List<String> seen = new ArrayList<>();
        final TaskDispatcher dispatcher = dispatcher(
                TaskHandler.of("start", (payload, context) -> seen.add(payload.get("jobId") + "#" + context.attempt()), p -> { }));
        queue.add(new QueuedTask("t1", "start", Map.of("jobId", "j1"), 1, 3));

        assertEquals(1, dispatcher.runDueTasks());

        assertEquals(List.of("j1#1"), seen);
        assertEquals(List.of("t1"), queue.completed);
        assertTrue(queue.failed.isEmpty());
    }

    @Test
    @DisplayName("A throwing handler fails the task with the exception type and message")
    void exceptionFails() {
        final TaskDispatcher dispatcher = dispatcher(
                TaskHandler.of("process", (payload, context) -> {
                    throw new IllegalStateException("store offline");
                }, p -> { }));
        queue.add(new QueuedTask("t1", "process", Map.of("jobId", "j1"), 1, 3));

        dispatcher.runDueTasks();

        assertTrue(queue.completed.isEmpty());
        assertEquals(List.of("t1: IllegalStateException: store offline"), queue.failed);
    }

    @Test
    @DisplayName("Tasks without a handler are failed, not dropped")
    void unknownTaskFails() {
        final TaskDispatcher dispatcher = dispatcher(TaskHandler.of("start", (payload, context) -> { }, p -> { }));
        queue.add(new QueuedTask("t1", "mystery", Map.of(), 1, 3));

        dispatcher.runDueTasks();

        assertEquals(List.of("t1: No handler for task mystery"), queue.failed);
    }

    @Test
    @DisplayName("runDueTasks keeps claiming until the queue has nothing due")
    void runDueTasksDrainsFollowUps() {
        final TaskDispatcher dispatcher = dispatcher(
                TaskHandler.of("start", (payload, context) ->
                        queue.add(new QueuedTask("t2", "poll", payload, 1, 3)), p -> { }),
                TaskHandler.of("poll", (payload, context) -> { }, p -> { }));
        queue.add(new QueuedTask("t1", "start", Map.of("jobId", "j1"), 1, 3));

        assertEquals(2, dispatcher.runDueTasks());
        assertEquals(List.of("t1", "t2"), queue.completed);
    }

    @Test
    @DisplayName("Abandoned tasks trigger the handler's abandon hook, and hook failures are contained")
    void abandonedTasksRunHook() {
        final List<String> abandoned = new ArrayList<>();
        final TaskDispatcher dispatcher = dispatcher(
                TaskHandler.of("process", (payload, context) -> { }, payload -> abandoned.add(payload.get("jobId"))),
                TaskHandler.of("poll", (payload, context) -> { }, payload -> {
                    throw new IllegalStateException("hook broke");
                }));
        queue.abandoned.add(new QueuedTask("t1", "process", Map.of("jobId", "j1"), 3, 3));
        queue.abandoned.add(new QueuedTask("t2", "poll", Map.of("jobId", "j2"), 3, 3));
        queue.abandoned.add(new QueuedTask("t3", "unknown", Map.of("jobId", "j3"), 3, 3));

        assertDoesNotThrow(dispatcher::runDueTasks);
        assertEquals(List.of("j1"), abandoned);
    }

    @Test
    @DisplayName("Two handlers for one task name are rejected at startup")
    void duplicateHandlersRejected() {
        final TaskHandler first = TaskHandler.of("start", (payload, context) -> { }, p -> { });
        final TaskHandler second = TaskHandler.of("start", (payload, context) -> { }, p -> { });

        assertThrows(IllegalStateException.class, () -> dispatcher(first, second));
    }

    @Test
    @DisplayName("dispatch claims no more than the pool can take and runs tasks on worker threads")
    void dispatchRespectsCapacity() throws InterruptedException {
        final CountDownLatch done = new CountDownLatch(2);
        final List<String> threads = new CopyOnWriteArrayList<>();
        final TaskDispatcher dispatcher = dispatcher(
                TaskHandler.of("start", (payload, context) -> {
                    threads.add(Thread.currentThread().getName());
                    done.countDown();
                }, p -> { }));
        for (int i = 0; i < 5; i++) {
            queue.add(new QueuedTask("t" + i, "start", Map.of("jobId", "j" + i), 1, 3));
        }

        dispatcher.dispatch();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(2), queue.requested);
        assertEquals(3, queue.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("dispatch-test-")));
    }

    @Test
    @DisplayName("The heartbeat renews the claims of running tasks and stops once they finish")
    void heartbeatRenewsRunningClaims() throws InterruptedException {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final TaskDispatcher dispatcher = dispatcher(
                TaskHandler.of("process", (payload, context) -> {
                    started.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }, p -> { }));
        queue.add(new QueuedTask("t1", "process", Map.of("jobId", "j1"), 1, 3));

        assertEquals(0, dispatcher.renewClaims());
        dispatcher.dispatch();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(1, dispatcher.renewClaims());
        assertEquals(List.of(List.of("t1")), queue.renewed);

        release.countDown();
        waitUntil(() -> queue.completed.contains("t1"));
        assertEquals(0, dispatcher.renewClaims());
        assertEquals(1, queue.renewed.size());
    }

    @Test
    @DisplayName("A heartbeat that does not fit twice into the visibility timeout is rejected at startup")
    void heartbeatMustFitVisibilityTimeout() {
        properties.getQueue().setVisibilityTimeout(Duration.ofMinutes(1));
        properties.getQueue().setHeartbeatIntervalMs(45_000);
        assertThrows(IllegalStateException.class, () -> dispatcher());

        properties.getQueue().setHeartbeatIntervalMs(0);
        assertThrows(IllegalStateException.class, () -> dispatcher());

        properties.getQueue().setHeartbeatIntervalMs(30_000);
        assertDoesNotThrow(() -> dispatcher());
    }

    // ---------- Helpers ----------

    private static void waitUntil(final BooleanSupplier condition) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    private TaskDispatcher dispatcher(final TaskHandler... handlers) {
        return new TaskDispatcher(queue, List.of(handlers), executor, properties);
    }

    /**
     * In-memory queue that records every outcome reported by the dispatcher.
     */
    private static final class RecordingQueue implements TaskQueue {

        private final Deque<QueuedTask> ready = new ArrayDeque<>();
        private final List<QueuedTask> abandoned = new ArrayList<>();
        private final List<Integer> requested = new CopyOnWriteArrayList<>();
        private final List<String> completed = new CopyOnWriteArrayList<>();
        private final List<String> failed = new CopyOnWriteArrayList<>();
        private final List<String> released = new CopyOnWriteArrayList<>();
        private final List<List<String>> renewed = new CopyOnWriteArrayList<>();

        synchronized void add(final QueuedTask task) {
            ready.addLast(task);
        }

        synchronized int size() {
            return ready.size();
        }

        @Override
        public synchronized String enqueue(final String taskName, final Map<String, String> payload, final Instant eta) {
            final String id = "t" + (ready.size() + completed.size() + 100);
            ready.addLast(new QueuedTask(id, taskName, payload, 1, 3));
            return id;
        }

        @Override
        public synchronized List<QueuedTask> claimDue(final int max) {
            requested.add(max);
            final List<QueuedTask> claimed = new ArrayList<>();
            while (claimed.size() < max && !ready.isEmpty()) {
                claimed.add(ready.removeFirst());
            }
            return claimed;
        }

        @Override
        public int renewClaims(final Collection<String> taskIds) {
            final List<String> ids = taskIds.stream().sorted().toList();
            renewed.add(ids);
            return ids.size();
        }

        @Override
        public void complete(final String taskId) {
            completed.add(taskId);
        }

        @Override
        public void fail(final String taskId, final String error) {
            failed.add(taskId + ": " + error);
        }

        @Override
        public void release(final String taskId) {
            released.add(taskId);
        }

        @Override
        public synchronized List<QueuedTask> buryAbandoned() {
            final List<QueuedTask> buried = new ArrayList<>(abandoned);
            abandoned.clear();
            return buried;
        }

        @Override
        public int purgeCompleted() {
            return 0;
        }
    }
}
