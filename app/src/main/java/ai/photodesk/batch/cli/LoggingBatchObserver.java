package ai.photodesk.batch.cli;

import ai.photodesk.batch.alttext.AltTextProgress;
import ai.photodesk.batch.queue.BatchItem;
import ai.photodesk.batch.queue.BatchObserver;
import ai.photodesk.batch.queue.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports batch progress through the application log.
 */
class LoggingBatchObserver implements BatchObserver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingBatchObserver.class);

    @Override
    public void onProgress(ProgressSnapshot snapshot) {
        if (snapshot.currentItemName().isEmpty()) {
            return;
        }
        LOGGER.info("[{}/{}] {} ({}% done, ~{}s remaining)", snapshot.currentItemIndex() + 1, snapshot.totalItems(),
                snapshot.currentItemName(), Math.round(snapshot.percentComplete()),
                snapshot.estimatedTimeRemaining().toSeconds());
    }

    @Override
    public void onItemComplete(BatchItem item) {
        LOGGER.debug("{} finished: transform={}, altText={}", item.fileName(), item.transformStatus(), item.altTextStatus());
    }

    @Override
    public void onAltTextProgress(AltTextProgress progress) {
        LOGGER.info("Alt text {}/{}: {} {}", progress.completed(), progress.total(), progress.path().getFileName(),
                progress.status());
    }
}
