package eu.virtualparadox.knowledge.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Opens the two Lucene indexes, one per store, under {@code knowledge.vector-index} and
 * {@code knowledge.graph-index}. Both are closed on shutdown.
 */
@Configuration
public class LuceneConfig {

    public static final String VECTOR_INDEX = "vectorLuceneIndex";
    public static final String GRAPH_INDEX = "graphLuceneIndex";

    @Bean(name = VECTOR_INDEX, destroyMethod = "close")
    public LuceneIndex vectorLuceneIndex(final ApplicationConfig props) throws IOException {
        return LuceneIndex.open("vectors", props.getVectorIndex());
    }

    @Bean(name = GRAPH_INDEX, destroyMethod = "close")
    public LuceneIndex graphLuceneIndex(final ApplicationConfig props) throws IOException {
        return LuceneIndex.open("graph", props.getGraphIndex());
    }
}
