package eu.virtualparadox.knowledge.application.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the task dispatcher's polling; {@code knowledge.scheduling.enabled=false} switches it off.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "knowledge.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
