package eu.virtualparadox.knowledge.queue;

import java.util.Map;

/**
 * A claimed task, ready to run.
 */
public record QueuedTask(String id, String name, Map<String, String> payload, int attempt, int maxAttempts) {

    public QueuedTask {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public TaskContext context() {
        return new TaskContext(id, attempt, maxAttempts);
    }
}
