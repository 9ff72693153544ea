package eu.virtualparadox.knowledge.queue;

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Body of one kind of task. Handlers must be idempotent: a task can be delivered more than once.
 * Throwing makes the queue retry the task.
 */
public interface TaskHandler {

    String taskName();

    void handle(Map<String, String> payload, TaskContext context);

    /**
     * Called once when the task is given up because its owner vanished on the last attempt.
     */
    default void onAbandoned(final Map<String, String> payload) {
    }

    static TaskHandler of(final String taskName,
                          final BiConsumer<Map<String, String>, TaskContext> body,
                          final Consumer<Map<String, String>> onAbandoned) {
        return new TaskHandler() {
            @Override
            public String taskName() {
                return taskName;
            }

            @Override
            public void handle(final Map<String, String> payload, final TaskContext context) {
                body.accept(payload, context);
            }

            @Override
            public void onAbandoned(final Map<String, String> payload) {
                onAbandoned.accept(payload);
            }
        };
    }
}
