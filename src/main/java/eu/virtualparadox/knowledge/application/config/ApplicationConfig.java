package eu.virtualparadox.knowledge.application.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout of the knowledge base, bound from {@code knowledge.*}.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "knowledge")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path vectorIndex;
    private Path graphIndex;
    private Path db;
    private Path models;

    @PostConstruct
    public void prepareLayout() throws IOException {
        if (vectorIndex != null && vectorIndex.equals(graphIndex)) {
            // each Lucene directory has a single writer lock
            throw new IllegalStateException("knowledge.vector-index and knowledge.graph-index must differ: " + vectorIndex);
        }
        for (final Path dir : new Path[]{root, vectorIndex, graphIndex, models}) {
            if (dir != null) {
                Files.createDirectories(dir);
            }
        }
        if (db != null && db.getParent() != null) {
            Files.createDirectories(db.getParent());
        }
        log.info("Knowledge base at {} (vectors {}, graph {})", root, vectorIndex, graphIndex);
    }
}
