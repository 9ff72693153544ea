package eu.virtualparadox.knowledge.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for concurrent per-chunk concept model calls. Kept apart from
 * {@link PipelineExecutor} because a stage running there waits for these calls.
 */
public class ConceptExecutor extends ThreadPoolTaskExecutor {
}
