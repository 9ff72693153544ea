package eu.virtualparadox.knowledge.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options for the embedding model.
     * <p>
     * Pipeline stages run several jobs in parallel, so a single session should not grab every core:
     * the intra-op pool is capped by {@code maxIntraThreads}.
     * </p>
     *
     * @param maxIntraThreads upper bound for intra-op threads, {@code <= 0} means "all but one core"
     */
    public static OrtSession.SessionOptions initializeOrt(final int maxIntraThreads) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            // leave one core free for other tasks
            final int availableProcessors = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
            final int intraThreads = maxIntraThreads > 0
                    ? Math.min(maxIntraThreads, availableProcessors)
                    : availableProcessors;

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session options: intra-op threads {}, inter-op threads {}", intraThreads, 1);
            return opts;
        }
        catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
