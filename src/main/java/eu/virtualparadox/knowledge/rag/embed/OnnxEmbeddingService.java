package eu.virtualparadox.knowledge.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.knowledge.application.config.ApplicationConfig;
import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embedding with a local ONNX model and its HuggingFace tokenizer.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} under {@code knowledge.models/<model-dir>}.
 * Token vectors are mean-pooled over the attention mask and L2-normalized.
 * </p>
 */
@Service
@ConditionalOnProperty(prefix = "knowledge.ingestion.embedding.onnx", name = "enabled", havingValue = "true")
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingService.class);

    private final Path modelPath;
    private final Path tokenizerPath;
    private final String modelVersion;
    private final int maxTokens;
    private final int intraOpThreads;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;
    private int dimension;

    public OnnxEmbeddingService(final ApplicationConfig config, final IngestionProperties properties) {
        final IngestionProperties.Onnx onnx = properties.getEmbedding().getOnnx();
        final Path modelRoot = config.getModels().resolve(onnx.getModelDir());
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
        this.modelVersion = onnx.getModelVersion();
        this.maxTokens = onnx.getMaxTokens();
        this.intraOpThreads = onnx.getIntraOpThreads();
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt(intraOpThreads);

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);
        this.dimension = embedBatch(List.of("dimension probe")).get(0).length;

        logger.info("Loaded ONNX embedding model {} ({}), dimension {}", modelVersion, modelPath, dimension);
        logger.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public String modelVersion() {
        return modelVersion;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        if (texts.isEmpty()) {
            return new ArrayList<>();
        }
        return embedBatch(texts);
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            if (maxLen > maxTokens) {
                maxLen = maxTokens;
            }

            final int batchSize = encodings.size();
            final long[][] inputIdArr = new long[batchSize][maxLen];
            final long[][] attnMaskArr = new long[batchSize][maxLen];
            final long[][] tokenTypeArr = new long[batchSize][maxLen];

            for (int i = 0; i < batchSize; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(batchSize);
                    for (int i = 0; i < batchSize; i++) {
                        final float[] vec = meanPool(embeddings[i], attnMaskArr[i]);
                        VectorMath.normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (final OrtException e) {
            throw new PermanentIngestionException(EFailureReason.PROCESSING_FAILED,
                    "ONNX model " + modelVersion + " failed to embed a batch of " + texts.size(), e);
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }
}
