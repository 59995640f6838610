package ai.photodesk.batch.alttext;

import java.nio.file.Path;

/**
 * Callbacks from {@link AltTextGenerationEngine#generateBatch}. Invoked on worker threads.
 */
public interface AltTextBatchListener {

    AltTextBatchListener NONE = new AltTextBatchListener() { };

    default void onRequestStarted(Path path) {
    }

    /**
     * @param resolved number of requests resolved so far, including this one
     * @param total number of requests in the batch
     */
    default void onRequestCompleted(Path path, AltTextResult result, int resolved, int total) {
    }
}
