package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.queue.TaskHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the job tasks to the {@link JobCoordinator}.
 */
@Configuration
public class IngestionTaskHandlers {

    @Bean
    public TaskHandler ingestStartHandler(final JobCoordinator coordinator) {
        return TaskHandler.of(IngestionTasks.START,
                (payload, context) -> coordinator.start(IngestionTasks.jobId(payload), context),
                payload -> coordinator.abandon(IngestionTasks.jobId(payload)));
    }

    @Bean
    public TaskHandler ingestPollHandler(final JobCoordinator coordinator) {
        return TaskHandler.of(IngestionTasks.POLL,
                (payload, context) -> coordinator.poll(IngestionTasks.jobId(payload), context),
                payload -> coordinator.abandon(IngestionTasks.jobId(payload)));
    }

    @Bean
    public TaskHandler ingestProcessHandler(final JobCoordinator coordinator) {
        return TaskHandler.of(IngestionTasks.PROCESS,
                (payload, context) -> coordinator.process(IngestionTasks.jobId(payload), context),
                payload -> coordinator.abandon(IngestionTasks.jobId(payload)));
    }

    @Bean
    public TaskHandler ingestReindexHandler(final JobCoordinator coordinator) {
        return TaskHandler.of(IngestionTasks.REINDEX,
                (payload, context) -> coordinator.reindex(IngestionTasks.jobId(payload), context),
                payload -> coordinator.abandon(IngestionTasks.jobId(payload)));
    }
}
