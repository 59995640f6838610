package ai.photodesk.batch.cli;

import ai.photodesk.batch.alttext.AltTextStatus;
import ai.photodesk.batch.alttext.ApiKeyValidation;
import ai.photodesk.batch.alttext.CostEstimate;
import ai.photodesk.batch.queue.BatchItem;
import ai.photodesk.batch.queue.BatchResult;
import ai.photodesk.batch.queue.TransformStatus;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes human readable run reports to the console.
 */
public class BatchReportPrinter {

    private final PrintStream out;

    public BatchReportPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void printResult(BatchResult result, List<BatchItem> items) {
        if (result.message().isPresent() && result.totalProcessed() == 0 && result.cancelledItems() == 0) {
            out.println("Batch not run: " + result.message().get());
            return;
        }
        out.printf(Locale.ROOT, "Processed %d images: %d succeeded, %d failed, %d cancelled in %s (avg %s)%n",
                result.totalProcessed(), result.successful(), result.failed(), result.cancelledItems(),
                seconds(result.elapsedTime()), seconds(result.averageTimePerImage()));
        if (result.altTextGenerated() + result.altTextFailed() > 0) {
            out.printf(Locale.ROOT, "Alt text: %d generated, %d failed%n", result.altTextGenerated(), result.altTextFailed());
        }
        if (result.cancelled()) {
            out.println("Run was cancelled.");
        }
        for (BatchItem item : items) {
            printItem(item);
        }
    }

    public void printCostEstimate(CostEstimate estimate) {
        out.printf(Locale.ROOT, "Images: %d%n", estimate.imageCount());
        out.println("Cost per image: " + usd(estimate.perImage()));
        out.println("Estimated batch cost: " + usd(estimate.total()));
        out.println("Estimated monthly cost (" + CostEstimate.BATCHES_PER_MONTH + " batches): " + usd(estimate.monthlyEstimate()));
    }

    public void printValidation(ApiKeyValidation validation) {
        out.println((validation.valid() ? "OK: " : "FAILED: ") + validation.message());
    }

    private void printItem(BatchItem item) {
        TransformStatus status = item.transformStatus();
        StringBuilder line = new StringBuilder("  ").append(item.fileName()).append(": ").append(status);
        if (status == TransformStatus.COMPLETED) {
            item.outputPath().ifPresent(path -> line.append(" -> ").append(path));
        }
        item.transformError().ifPresent(error -> line.append(" (").append(error).append(')'));
        out.println(line);
        if (item.altTextStatus() == AltTextStatus.COMPLETED) {
            out.println("    alt: " + item.altText().orElse(""));
        } else if (item.altTextStatus() == AltTextStatus.ERROR) {
            out.println("    alt text error: " + item.altTextError().orElse("unknown"));
        }
    }

    static String usd(BigDecimal amount) {
        return "$" + amount.setScale(Math.max(2, amount.scale()), RoundingMode.HALF_UP).toPlainString();
    }

    private static String seconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2fs", duration.toMillis() / 1000.0);
    }
}
