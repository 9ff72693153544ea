package eu.virtualparadox.knowledge.ingest.pipeline;

import eu.virtualparadox.knowledge.ingest.chunker.ChunkingRequest;
import eu.virtualparadox.knowledge.ingest.chunker.ChunkingSettings;
import eu.virtualparadox.knowledge.ingest.chunker.SemanticChunker;
import eu.virtualparadox.knowledge.ingest.cleaner.NormalizedText;
import eu.virtualparadox.knowledge.ingest.cleaner.TextNormalizer;
import eu.virtualparadox.knowledge.ingest.concept.ConceptExtractor;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.JobCancelledException;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.Embedding;
import eu.virtualparadox.knowledge.rag.embed.EmbeddingGenerator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunk, extract concepts, embed. Assembled per job by {@link PipelineFactory}.
 * <p>
 * Stages run strictly in this order and nothing is written anywhere; the caller persists the
 * {@link PipelineResult}. Cancellation is checked between stages.
 * </p>
 */
@Slf4j
public class Pipeline {

    private final TextNormalizer normalizer;
    private final SemanticChunker chunker;
    private final ChunkingSettings chunking;
    private final ConceptExtractor conceptExtractor;
    private final EmbeddingGenerator embeddingGenerator;
    private final StageRunner runner;

    public Pipeline(final TextNormalizer normalizer,
                    final SemanticChunker chunker,
                    final ChunkingSettings chunking,
                    final ConceptExtractor conceptExtractor,
                    final EmbeddingGenerator embeddingGenerator,
                    final StageRunner runner) {
        this.normalizer = normalizer;
        this.chunker = chunker;
        this.chunking = chunking;
        this.conceptExtractor = conceptExtractor;
        this.embeddingGenerator = embeddingGenerator;
        this.runner = runner;
    }

    public ConceptExtractor conceptExtractor() {
        return conceptExtractor;
    }

    public String embeddingModelVersion() {
        return embeddingGenerator.modelVersion();
    }

    /**
     * @param jobId         owning job
     * @param content       raw retrieved text
     * @param sectionStarts offsets of section starts in {@code content}, may be empty
     * @param cancellation  polled between stages
     * @throws PermanentIngestionException if the content yields no chunks or a stage fails for good
     * @throws JobCancelledException       if the job was cancelled between stages
     */
    public PipelineResult run(final String jobId,
                              final String content,
                              final List<Integer> sectionStarts,
                              final CancellationCheck cancellation) {
        final List<StageProvenance> provenance = new ArrayList<>();

        final NormalizedText text = normalizer.normalize(content == null ? "" : content,
                sectionStarts == null ? List.of() : sectionStarts);

        final StageRunner.StageResult<List<Chunk>> chunked = runner.run(jobId, chunker,
                new ChunkingRequest(jobId, text, chunking), List::size,
                "budget=" + chunking.tokenBudget() + ", overlap=" + chunking.overlapTokens());
        provenance.add(chunked.provenance());
        final List<Chunk> chunks = chunked.output();
        if (chunks.isEmpty()) {
            throw new PermanentIngestionException(EFailureReason.EMPTY_CONTENT,
                    "Source content of job " + jobId + " is empty after normalization");
        }
        checkCancelled(jobId, cancellation);

        final StageRunner.StageResult<List<Concept>> extracted = runner.run(jobId, conceptExtractor,
                chunks, List::size, conceptExtractor.getClass().getSimpleName());
        provenance.add(extracted.provenance());
        checkCancelled(jobId, cancellation);

        final StageRunner.StageResult<List<Embedding>> embedded = runner.run(jobId, embeddingGenerator,
                chunks, List::size, embeddingGenerator.modelVersion());
        provenance.add(embedded.provenance());

        log.info("Job {}: pipeline produced {} chunks, {} concepts, {} embeddings",
                jobId, chunks.size(), extracted.output().size(), embedded.output().size());
        return new PipelineResult(chunks, extracted.output(), embedded.output(),
                embeddingGenerator.modelVersion(), provenance);
    }

    private void checkCancelled(final String jobId, final CancellationCheck cancellation) {
        if (cancellation.isCancelled()) {
            log.info("Job {}: cancelled between pipeline stages", jobId);
            throw new JobCancelledException(jobId);
        }
    }
}
