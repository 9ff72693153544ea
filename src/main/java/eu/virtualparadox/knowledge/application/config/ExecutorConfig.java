package eu.virtualparadox.knowledge.application.config;

import eu.virtualparadox.knowledge.application.executor.ConceptExecutor;
import eu.virtualparadox.knowledge.application.executor.IngestionExecutor;
import eu.virtualparadox.knowledge.application.executor.PipelineExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    /**
     * Workers running queue tasks. The queue is the backlog, so the executor queue stays small.
     */
    @Bean
    public IngestionExecutor ingestionExecutor(@Value("${knowledge.executor.ingestion-threads:2}") final int threads) {
        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Dedicated slots for pipeline stages and per-chunk model calls, so one slow source cannot
     * starve the task workers.
     */
    @Bean
    public PipelineExecutor pipelineExecutor(final IngestionProperties properties) {
        PipelineExecutor executor = new PipelineExecutor();
        executor.setCorePoolSize(properties.getPipeline().getWorkerThreads());
        executor.setMaxPoolSize(properties.getPipeline().getWorkerThreads());
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public ConceptExecutor conceptExecutor(final IngestionProperties properties) {
        ConceptExecutor executor = new ConceptExecutor();
        executor.setCorePoolSize(properties.getConcepts().getParallelism());
        executor.setMaxPoolSize(properties.getConcepts().getParallelism());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("concepts-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
