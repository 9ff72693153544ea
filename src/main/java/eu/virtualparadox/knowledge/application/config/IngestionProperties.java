package eu.virtualparadox.knowledge.application.config;

import eu.virtualparadox.knowledge.util.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Knobs of the ingestion pipeline, bound from {@code knowledge.ingestion.*}.
 * Defaults below apply when a property is absent.
 */
@Configuration
@ConfigurationProperties(prefix = "knowledge.ingestion")
@Getter @Setter
public class IngestionProperties {

    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Concepts concepts = new Concepts();
    private Transcription transcription = new Transcription();
    private Poll poll = new Poll();
    private Pipeline pipeline = new Pipeline();
    /** Bounded retry of source fetches and external job submission. */
    private Retry sourceRetry = new Retry();
    /** Bounded retry of vector and graph writes. */
    private Retry writeRetry = new Retry();
    private Queue queue = new Queue();

    @Getter @Setter
    public static class Chunking {
        private int tokenBudget = 512;
        private int overlapTokens = 50;
    }

    @Getter @Setter
    public static class Embedding {
        private int batchSize = 32;
        /** Model version used when a job names none; blank picks the first registered model. */
        private String defaultModel = "";
        private int hashingDimension = 384;
        private Onnx onnx = new Onnx();
    }

    @Getter @Setter
    public static class Onnx {
        private boolean enabled = false;
        private String modelVersion = "onnx-retriever";
        /** Directory under {@code knowledge.models} holding model.onnx and tokenizer.json. */
        private String modelDir = "retriever";
        private int maxTokens = 512;
        /** Upper bound for intra-op threads, 0 means all but one core. */
        private int intraOpThreads = 0;
    }

    @Getter @Setter
    public static class Concepts {
        private boolean enabled = false;
        /** Base URL of an OpenAI-compatible API, e.g. https://api.openai.com/v1 */
        private String baseUrl;
        private String model = "gpt-4.1-mini";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxEntities = 6;
        private int maxRelations = 3;
        private double minConfidence = 0.8;
        /** Concurrent model calls per node. */
        private int parallelism = 4;
    }

    @Getter @Setter
    public static class Transcription {
        /** Base URL of the transcription service; blank disables transcribed sources. */
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter @Setter
    public static class Poll {
        private Duration baseDelay = Duration.ofSeconds(5);
        private double factor = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);
        /** Relative jitter, 0.2 means +/-20%. */
        private double jitter = 0.2;
        private Duration maxWait = Duration.ofHours(1);
    }

    @Getter @Setter
    public static class Pipeline {
        private Duration stageTimeout = Duration.ofMinutes(10);
        private Retry stageRetry = new Retry();
        private int workerThreads = 4;
    }

    @Getter @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
        }
    }

    @Getter @Setter
    public static class Queue {
        private long pollIntervalMs = 1000;
        private int batchSize = 16;
        /** A claimed task older than this is considered abandoned and delivered again. */
        private Duration visibilityTimeout = Duration.ofMinutes(30);
        /** How often running tasks renew their claim; must fit at least twice into the visibility timeout. */
        private long heartbeatIntervalMs = 60_000;
        private int maxAttempts = 5;
        private Duration retryBackoff = Duration.ofSeconds(10);
        /** Completed tasks are purged after this period. */
        private Duration retention = Duration.ofDays(7);
    }
}
