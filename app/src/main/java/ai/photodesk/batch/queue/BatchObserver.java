package ai.photodesk.batch.queue;

import ai.photodesk.batch.alttext.AltTextProgress;

/**
 * Receives batch events. Exceptions thrown here are logged and do not affect the run.
 * {@link #onAltTextProgress} is called from alt-text worker threads.
 */
public interface BatchObserver {

    void onProgress(ProgressSnapshot snapshot);

    void onItemComplete(BatchItem item);

    default void onAltTextProgress(AltTextProgress progress) {
    }
}
