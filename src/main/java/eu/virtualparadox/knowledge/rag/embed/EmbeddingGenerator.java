package eu.virtualparadox.knowledge.rag.embed;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.IngestionException;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Embedding;
import eu.virtualparadox.knowledge.ingest.pipeline.Processor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds chunks in fixed-size batches.
 * <p>
 * Output position {@code i} always belongs to input chunk {@code i}. A batch either succeeds
 * completely or fails as a whole: a wrong vector count or a wrong vector length is a permanent
 * failure of the batch, and nothing from it is returned.
 * </p>
 */
@Slf4j
public class EmbeddingGenerator implements Processor<List<Chunk>, List<Embedding>> {

    public static final String STAGE_NAME = "embed";

    private final EmbeddingService model;
    private final int batchSize;

    public EmbeddingGenerator(final EmbeddingService model, final int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.model = model;
        this.batchSize = batchSize;
    }

    @Override
    public String name() {
        return STAGE_NAME;
    }

    public String modelVersion() {
        return model.modelVersion();
    }

    @Override
    public List<Embedding> process(final List<Chunk> chunks) {
        return embed(chunks);
    }

    public List<Embedding> embed(final List<Chunk> chunks) {
        final List<Embedding> out = new ArrayList<>(chunks.size());
        for (int from = 0; from < chunks.size(); from += batchSize) {
            final List<Chunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            out.addAll(embedBatch(batch, from));
        }
        return out;
    }

    private List<Embedding> embedBatch(final List<Chunk> batch, final int offset) {
        final List<String> texts = new ArrayList<>(batch.size());
        for (final Chunk chunk : batch) {
            texts.add(chunk.text());
        }

        final List<float[]> vectors;
        try {
            vectors = model.embed(texts);
        } catch (IngestionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PermanentIngestionException(EFailureReason.PROCESSING_FAILED,
                    "Embedding model " + model.modelVersion() + " failed on batch at " + offset, e);
        }

        if (vectors == null || vectors.size() != batch.size()) {
            throw new PermanentIngestionException(EFailureReason.PROCESSING_FAILED,
                    "Embedding model " + model.modelVersion() + " returned "
                            + (vectors == null ? 0 : vectors.size()) + " vectors for " + batch.size() + " chunks");
        }

        final int expected = model.dimension();
        final List<Embedding> out = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            final float[] vector = vectors.get(i);
            if (vector == null || vector.length != expected) {
                throw new PermanentIngestionException(EFailureReason.PROCESSING_FAILED,
                        "Embedding model " + model.modelVersion() + " returned a vector of length "
                                + (vector == null ? 0 : vector.length) + ", expected " + expected);
            }
            out.add(new Embedding(batch.get(i).id(), vector, model.modelVersion()));
        }
        log.debug("Embedded batch of {} chunks at offset {}", batch.size(), offset);
        return out;
    }
}
