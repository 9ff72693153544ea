package eu.virtualparadox.knowledge.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool executing claimed queue tasks.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
