package ai.photodesk.batch.queue;

import ai.photodesk.batch.alttext.AltTextBatchListener;
import ai.photodesk.batch.alttext.AltTextGenerationEngine;
import ai.photodesk.batch.alttext.AltTextProgress;
import ai.photodesk.batch.alttext.AltTextResult;
import ai.photodesk.batch.transform.FilenameTemplate;
import ai.photodesk.batch.transform.ImageTransformer;
import ai.photodesk.batch.transform.Preset;
import ai.photodesk.batch.transform.Presets;
import ai.photodesk.batch.transform.SupportedImageTypes;
import ai.photodesk.batch.transform.TransformException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Owns the image queue and runs batches: a sequential transform phase followed, on request, by a bounded
 * parallel alt-text phase for the images that were transformed successfully.
 *
 * <p>Only one run may be active at a time. While a run is active the queue cannot be modified.
 * Cancellation is cooperative: the transform phase stops before the next item and the alt-text phase stops
 * dispatching new requests, but work already started always finishes.
 */
public class BatchProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);

    public static final String MDC_ITEM = "item";

    private final Supplier<ImageTransformer> transformerFactory;
    private final AltTextGenerationEngine altTextEngine;
    private final List<BatchItem> queue = new ArrayList<>();
    private final List<BatchObserver> observers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean();
    private volatile boolean cancelRequested;

    public BatchProcessor(Supplier<ImageTransformer> transformerFactory) {
        this(transformerFactory, null);
    }

    /**
     * @param transformerFactory supplies a fresh transformer for every item
     * @param altTextEngine engine for the alt-text phase; {@code null} disables it
     */
    public BatchProcessor(Supplier<ImageTransformer> transformerFactory, AltTextGenerationEngine altTextEngine) {
        this.transformerFactory = Objects.requireNonNull(transformerFactory, "transformerFactory");
        this.altTextEngine = altTextEngine;
    }

    public void addObserver(BatchObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public void removeObserver(BatchObserver observer) {
        observers.remove(observer);
    }

    public boolean addImage(Path imagePath) {
        if (imagePath == null) {
            return false;
        }
        Path normalized = imagePath.toAbsolutePath().normalize();
        if (!SupportedImageTypes.isSupported(normalized)) {
            LOGGER.warn("Unsupported format: {}", normalized);
            return false;
        }
        if (!Files.isRegularFile(normalized)) {
            LOGGER.warn("File does not exist or is not a regular file: {}", normalized);
            return false;
        }
        long fileSize;
        try {
            fileSize = Files.size(normalized);
        } catch (IOException ex) {
            LOGGER.warn("Cannot read size of {}: {}", normalized, ex.getMessage());
            return false;
        }
        synchronized (this) {
            if (processing.get()) {
                LOGGER.warn("Cannot add {} while a batch is running", normalized.getFileName());
                return false;
            }
            if (findItem(normalized).isPresent()) {
                LOGGER.warn("Image already in queue: {}", normalized);
                return false;
            }
            queue.add(new BatchItem(normalized, fileSize));
        }
        LOGGER.info("Added to queue: {}", normalized.getFileName());
        return true;
    }

    public int addFolder(Path folder) {
        return addFolder(folder, false);
    }

    /**
     * Adds every supported image of a folder, in file name order.
     *
     * @return the number of images added; 0 when the path is not a directory or holds no images
     */
    public int addFolder(Path folder, boolean recursive) {
        if (folder == null || !Files.isDirectory(folder)) {
            LOGGER.info("Not a directory, nothing added: {}", folder);
            return 0;
        }
        Comparator<Path> order = Comparator.comparing(path -> path.getFileName().toString());
        if (recursive) {
            order = Comparator.naturalOrder();
        }
        List<Path> candidates;
        try (Stream<Path> entries = recursive ? Files.walk(folder) : Files.list(folder)) {
            candidates = entries
                    .filter(Files::isRegularFile)
                    .filter(SupportedImageTypes::isSupported)
                    .sorted(order)
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            LOGGER.warn("Failed to scan {}: {}", folder, ex.getMessage());
            return 0;
        }
        int added = 0;
        for (Path candidate : candidates) {
            if (addImage(candidate)) {
                added++;
            }
        }
        LOGGER.info("Added {} images from {}", added, folder);
        return added;
    }

    public synchronized boolean removeImage(int index) {
        if (processing.get()) {
            LOGGER.warn("Cannot remove images while a batch is running");
            return false;
        }
        if (index < 0 || index >= queue.size()) {
            return false;
        }
        BatchItem removed = queue.remove(index);
        LOGGER.info("Removed from queue: {}", removed.fileName());
        return true;
    }

    public synchronized boolean clearQueue() {
        if (processing.get()) {
            LOGGER.warn("Cannot clear the queue while a batch is running");
            return false;
        }
        queue.clear();
        LOGGER.info("Queue cleared");
        return true;
    }

    /**
     * @return copies of the queued items in queue order
     */
    public synchronized List<BatchItem> items() {
        List<BatchItem> copies = new ArrayList<>(queue.size());
        for (BatchItem item : queue) {
            copies.add(item.copy());
        }
        return List.copyOf(copies);
    }

    public synchronized int queueSize() {
        return queue.size();
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public void cancelProcessing() {
        cancelRequested = true;
        LOGGER.info("Batch processing cancellation requested");
    }

    public BatchResult processBatch(String presetName, Path outputFolder) {
        return processBatch(presetName, outputFolder, null);
    }

    /**
     * Transforms every pending item with the named preset.
     *
     * @param filenameTemplate optional output name template; the preset's default name is used when blank
     */
    public BatchResult processBatch(String presetName, Path outputFolder, String filenameTemplate) {
        return run(presetName, outputFolder, filenameTemplate, false, null);
    }

    public BatchResult processBatchWithAltText(String presetName, Path outputFolder) {
        return processBatchWithAltText(presetName, outputFolder, null, null);
    }

    public BatchResult processBatchWithAltText(String presetName, Path outputFolder, String context) {
        return processBatchWithAltText(presetName, outputFolder, context, null);
    }

    /**
     * Transforms every pending item, then generates alt text for the processed outputs.
     * Alt-text failures are reported in the result counters and never change transform outcomes.
     */
    public BatchResult processBatchWithAltText(String presetName, Path outputFolder, String context,
                                               String filenameTemplate) {
        if (altTextEngine == null) {
            return BatchResult.failure("Alt text generation is not configured");
        }
        return run(presetName, outputFolder, filenameTemplate, true, context);
    }

    /**
     * Discards the alt text of a transformed item and generates it again.
     *
     * @return the new result, or empty when the item is unknown, not transformed or a batch is running
     */
    public Optional<AltTextResult> regenerateAltText(Path sourcePath, String context) {
        if (altTextEngine == null || sourcePath == null) {
            return Optional.empty();
        }
        Optional<BatchItem> candidate;
        synchronized (this) {
            candidate = findItem(sourcePath.toAbsolutePath().normalize());
        }
        if (candidate.isEmpty() || candidate.get().transformStatus() != TransformStatus.COMPLETED) {
            LOGGER.warn("No processed image to regenerate alt text for: {}", sourcePath);
            return Optional.empty();
        }
        if (!processing.compareAndSet(false, true)) {
            LOGGER.warn("Cannot regenerate alt text while a batch is running");
            return Optional.empty();
        }
        try {
            BatchItem item = candidate.get();
            item.resetAltText();
            item.markAltTextGenerating();
            AltTextResult result = altTextEngine.generateAltText(item.outputPath().orElseThrow(), context);
            item.applyAltText(result);
            notifyItemComplete(item.copy());
            return Optional.of(result);
        } finally {
            processing.set(false);
        }
    }

    public Optional<AltTextResult> regenerateAltText(Path sourcePath) {
        return regenerateAltText(sourcePath, null);
    }

    private BatchResult run(String presetName, Path outputFolder, String filenameTemplate, boolean withAltText,
                            String context) {
        Objects.requireNonNull(outputFolder, "outputFolder");
        if (!processing.compareAndSet(false, true)) {
            LOGGER.warn("Batch processing already in progress");
            return BatchResult.failure("Batch processing already in progress");
        }
        try {
            List<BatchItem> pending = pendingItems();
            if (pending.isEmpty()) {
                LOGGER.warn("No images in queue");
                return BatchResult.failure("No images to process");
            }
            Optional<Preset> preset = Presets.find(presetName);
            if (preset.isEmpty()) {
                LOGGER.error("Invalid preset: {}", presetName);
                return BatchResult.failure("Invalid preset: " + presetName);
            }
            cancelRequested = false;
            FilenameTemplate template = filenameTemplate == null || filenameTemplate.isBlank()
                    ? null
                    : new FilenameTemplate(filenameTemplate);

            BatchResult result = runTransformPhase(pending, preset.get(), outputFolder, template);
            if (withAltText) {
                result = runAltTextPhase(pending, context, result);
            }
            LOGGER.info("Batch processing complete: {} succeeded, {} failed, {} cancelled, alt text {}/{} in {} ms",
                    result.successful(), result.failed(), result.cancelledItems(), result.altTextGenerated(),
                    result.altTextGenerated() + result.altTextFailed(), result.elapsedTime().toMillis());
            return result;
        } catch (RuntimeException ex) {
            LOGGER.error("Batch processing failed", ex);
            return BatchResult.failure("Batch processing failed: " + ex.getMessage());
        } finally {
            processing.set(false);
        }
    }

    private BatchResult runTransformPhase(List<BatchItem> items, Preset preset, Path outputFolder,
                                          FilenameTemplate template) {
        int total = items.size();
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        int lastIndex = -1;
        long processedNanos = 0L;
        long runStarted = System.nanoTime();
        Set<Path> claimedOutputs = new HashSet<>();
        LOGGER.info("Processing {} images with preset {} into {}", total, preset.key(), outputFolder);

        for (int index = 0; index < total; index++) {
            BatchItem item = items.get(index);
            if (cancelRequested) {
                for (int rest = index; rest < total; rest++) {
                    BatchItem skipped = items.get(rest);
                    skipped.markCancelled();
                    cancelled++;
                    notifyItemComplete(skipped.copy());
                }
                LOGGER.info("Batch cancelled; {} images not processed", total - index);
                break;
            }
            Duration average = average(processedNanos, completed + failed);
            notifyProgress(new ProgressSnapshot(total, completed, failed, cancelled, index, item.fileName(),
                    elapsedSince(runStarted), average.multipliedBy(total - index), average, false));

            Path outputPath = uniqueOutput(outputFolder.resolve(template == null
                    ? preset.suggestedFilename(item.sourcePath())
                    : template.render(item.sourcePath(), preset)), claimedOutputs);
            lastIndex = index;
            if (transformItem(item, preset, outputPath)) {
                completed++;
            } else {
                failed++;
            }
            processedNanos += item.processingTime().toNanos();
            average = average(processedNanos, completed + failed);

            notifyItemComplete(item.copy());
            notifyProgress(new ProgressSnapshot(total, completed, failed, cancelled, index, item.fileName(),
                    elapsedSince(runStarted), average.multipliedBy(total - index - 1L), average, false));
        }

        boolean wasCancelled = cancelRequested;
        Duration elapsed = elapsedSince(runStarted);
        Duration average = average(processedNanos, completed + failed);
        notifyProgress(new ProgressSnapshot(total, completed, failed, cancelled, lastIndex, "", elapsed,
                Duration.ZERO, average, wasCancelled));
        return new BatchResult(failed == 0, completed + failed, completed, failed, cancelled, wasCancelled,
                elapsed, average, 0, 0, Optional.empty());
    }

    private boolean transformItem(BatchItem item, Preset preset, Path outputPath) {
        item.markProcessing();
        long started = System.nanoTime();
        ImageTransformer transformer = null;
        MDC.put(MDC_ITEM, item.fileName());
        try {
            transformer = transformerFactory.get();
            if (!transformer.loadImage(item.sourcePath())) {
                item.markFailed("Failed to load image", elapsedSince(started));
                LOGGER.error("Failed to process {}: could not load image", item.fileName());
                return false;
            }
            Path written = transformer.process(preset, outputPath);
            item.markCompleted(written, elapsedSince(started));
            LOGGER.info("Processed {} -> {}", item.fileName(), written.getFileName());
            return true;
        } catch (TransformException ex) {
            item.markFailed(ex.getMessage(), elapsedSince(started));
            LOGGER.error("Failed to process {}: {}", item.fileName(), ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            item.markFailed("Unexpected error: " + ex.getMessage(), elapsedSince(started));
            LOGGER.error("Unexpected error processing {}", item.fileName(), ex);
            return false;
        } finally {
            release(transformer);
            MDC.remove(MDC_ITEM);
        }
    }

    /**
     * Output paths are claimed per run; a name already taken gets a numeric suffix before its extension.
     */
    private static Path uniqueOutput(Path candidate, Set<Path> claimed) {
        if (claimed.add(candidate.toAbsolutePath().normalize())) {
            return candidate;
        }
        String name = candidate.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        for (int counter = 1; ; counter++) {
            Path renamed = candidate.resolveSibling(stem + "_" + counter + extension);
            if (claimed.add(renamed.toAbsolutePath().normalize())) {
                LOGGER.warn("Output {} already used in this batch; writing {} instead", name, renamed.getFileName());
                return renamed;
            }
        }
    }

    private BatchResult runAltTextPhase(List<BatchItem> items, String context, BatchResult transformResult) {
        Map<Path, List<BatchItem>> byOutput = new LinkedHashMap<>();
        for (BatchItem item : items) {
            if (item.transformStatus() != TransformStatus.COMPLETED) {
                continue;
            }
            Path output = item.outputPath().orElseThrow();
            List<BatchItem> sharing = byOutput.computeIfAbsent(output, key -> new ArrayList<>());
            if (!sharing.isEmpty()) {
                LOGGER.warn("{} and {} share output {}; alt text is generated once", sharing.get(0).fileName(),
                        item.fileName(), output.getFileName());
            }
            sharing.add(item);
        }
        if (byOutput.isEmpty()) {
            LOGGER.info("No processed images; skipping alt text generation");
            return transformResult;
        }

        Map<Path, AltTextResult> results = altTextEngine.generateBatch(byOutput.keySet(), context,
                () -> cancelRequested, new AltTextBatchListener() {
                    @Override
                    public void onRequestStarted(Path path) {
                        for (BatchItem item : byOutput.getOrDefault(path, List.of())) {
                            item.markAltTextGenerating();
                        }
                    }

                    @Override
                    public void onRequestCompleted(Path path, AltTextResult result, int resolved, int total) {
                        notifyAltTextProgress(new AltTextProgress(resolved, total, path, result.status()));
                    }
                });

        int generated = 0;
        int failed = 0;
        for (Map.Entry<Path, AltTextResult> entry : results.entrySet()) {
            for (BatchItem item : byOutput.getOrDefault(entry.getKey(), List.of())) {
                item.applyAltText(entry.getValue());
                if (entry.getValue().isSuccess()) {
                    generated++;
                } else {
                    failed++;
                }
                notifyItemComplete(item.copy());
            }
        }
        BatchResult result = transformResult.withAltText(generated, failed);
        if (cancelRequested && !result.cancelled()) {
            result = new BatchResult(result.success(), result.totalProcessed(), result.successful(), result.failed(),
                    result.cancelledItems(), true, result.elapsedTime(), result.averageTimePerImage(),
                    generated, failed, result.message());
        }
        return result;
    }

    private synchronized List<BatchItem> pendingItems() {
        return queue.stream()
                .filter(item -> item.transformStatus() == TransformStatus.PENDING)
                .collect(Collectors.toList());
    }

    private Optional<BatchItem> findItem(Path normalized) {
        return queue.stream().filter(item -> item.sourcePath().equals(normalized)).findFirst();
    }

    private void release(ImageTransformer transformer) {
        if (transformer == null) {
            return;
        }
        try {
            transformer.release();
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to release transformer: {}", ex.getMessage());
        }
    }

    private void notifyProgress(ProgressSnapshot snapshot) {
        for (BatchObserver observer : observers) {
            try {
                observer.onProgress(snapshot);
            } catch (RuntimeException ex) {
                LOGGER.error("Error in progress observer", ex);
            }
        }
    }

    private void notifyItemComplete(BatchItem item) {
        for (BatchObserver observer : observers) {
            try {
                observer.onItemComplete(item);
            } catch (RuntimeException ex) {
                LOGGER.error("Error in item complete observer", ex);
            }
        }
    }

    private void notifyAltTextProgress(AltTextProgress progress) {
        for (BatchObserver observer : observers) {
            try {
                observer.onAltTextProgress(progress);
            } catch (RuntimeException ex) {
                LOGGER.error("Error in alt text progress observer", ex);
            }
        }
    }

    private static Duration average(long totalNanos, int count) {
        return count == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / count);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
