package eu.virtualparadox.knowledge.application.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.knowledge.ingest.concept.ConceptModelClient;
import eu.virtualparadox.knowledge.ingest.concept.OpenAiCompatibleConceptModelClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ConceptModelConfig {

    /**
     * Only created when concept extraction is switched on; otherwise pipelines use the disabled extractor.
     */
    @Bean
    @ConditionalOnProperty(prefix = "knowledge.ingestion.concepts", name = "enabled", havingValue = "true")
    public ConceptModelClient conceptModelClient(final IngestionProperties properties,
                                                 final RestTemplateBuilder restTemplateBuilder,
                                                 final ObjectMapper objectMapper) {
        final IngestionProperties.Concepts concepts = properties.getConcepts();
        return new OpenAiCompatibleConceptModelClient(
                concepts.getBaseUrl(),
                concepts.getModel(),
                concepts.getApiKey(),
                concepts.getTimeout(),
                restTemplateBuilder,
                objectMapper);
    }
}
