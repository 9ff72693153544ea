package eu.virtualparadox.knowledge.ingest.pipeline;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.application.executor.ConceptExecutor;
import eu.virtualparadox.knowledge.application.executor.PipelineExecutor;
import eu.virtualparadox.knowledge.ingest.chunker.ChunkingSettings;
import eu.virtualparadox.knowledge.ingest.chunker.SemanticChunker;
import eu.virtualparadox.knowledge.ingest.cleaner.TextNormalizer;
import eu.virtualparadox.knowledge.ingest.concept.ConceptExtractor;
import eu.virtualparadox.knowledge.ingest.concept.ConceptLimits;
import eu.virtualparadox.knowledge.ingest.concept.ConceptModelClient;
import eu.virtualparadox.knowledge.ingest.concept.DisabledConceptExtractor;
import eu.virtualparadox.knowledge.ingest.concept.ModelConceptExtractor;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;
import eu.virtualparadox.knowledge.rag.embed.EmbeddingGenerator;
import eu.virtualparadox.knowledge.rag.embed.EmbeddingModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Assembles the {@link Pipeline} for a job from configuration and the job's options.
 * <p>
 * This is the only place that decides between the model-backed and the disabled concept
 * extractor. Invalid options surface here as permanent failures.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineFactory {

    private final TextNormalizer normalizer;
    private final SemanticChunker chunker;
    private final EmbeddingModelRegistry embeddingModels;
    private final Optional<ConceptModelClient> conceptModelClient;
    private final ConceptExecutor conceptExecutor;
    private final PipelineExecutor pipelineExecutor;
    private final IngestionProperties properties;
    private final Clock clock;

    public Pipeline create(final IngestionOptions options) {
        final IngestionOptions effective = options != null ? options : IngestionOptions.defaults();

        final ChunkingSettings chunking = ChunkingSettings.resolve(
                properties.getChunking().getTokenBudget(),
                properties.getChunking().getOverlapTokens(),
                effective);

        final EmbeddingGenerator embeddingGenerator = new EmbeddingGenerator(
                embeddingModels.resolve(effective.embeddingModelVersion()),
                properties.getEmbedding().getBatchSize());

        final StageRunner runner = new StageRunner(
                pipelineExecutor,
                properties.getPipeline().getStageTimeout(),
                properties.getPipeline().getStageRetry().toPolicy(),
                clock);

        return new Pipeline(normalizer, chunker, chunking, conceptExtractor(effective), embeddingGenerator, runner);
    }

    ConceptExtractor conceptExtractor(final IngestionOptions options) {
        if (!properties.getConcepts().isEnabled() || options.skipConcepts()) {
            return DisabledConceptExtractor.INSTANCE;
        }
        if (conceptModelClient.isEmpty()) {
            log.warn("Concept extraction is enabled but no concept model client is configured, skipping concepts");
            return DisabledConceptExtractor.INSTANCE;
        }

        final IngestionProperties.Concepts concepts = properties.getConcepts();
        return new ModelConceptExtractor(conceptModelClient.get(), conceptExecutor,
                new ConceptLimits(concepts.getMaxEntities(), concepts.getMaxRelations(), concepts.getMinConfidence()));
    }
}
