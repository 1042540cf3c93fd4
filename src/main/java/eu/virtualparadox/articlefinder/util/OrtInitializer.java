package eu.virtualparadox.articlefinder.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options sized for query-time inference: intra-op parallelism on all but one core, no
     * inter-op parallelism since queries already run concurrently.
     */
    public static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            // leave one core free for the capability pool
            final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX Runtime intra-op threads: {}, inter-op threads: {}", intraThreads, 1);
            return opts;
        }
        catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
