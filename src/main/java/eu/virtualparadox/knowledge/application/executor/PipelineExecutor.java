package eu.virtualparadox.knowledge.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for pipeline stages and per-chunk model calls.
 */
public class PipelineExecutor extends ThreadPoolTaskExecutor {
}
