package ai.photodesk.batch.usage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists usage statistics as a small JSON document, rewritten on every recorded call.
 */
public class JsonFileUsageTracker implements UsageTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileUsageTracker.class);
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonFileUsageTracker(Path file) {
        this(file, Clock.systemDefaultZone());
    }

    public JsonFileUsageTracker(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void recordUsage(BigDecimal cost) {
        Objects.requireNonNull(cost, "cost");
        String month = YearMonth.now(clock).format(MONTH_FORMAT);
        UsageStats updated = stats().add(month, cost);
        write(updated);
        LOGGER.debug("Recorded API usage of {} (month {} total {})", cost, month, updated.forMonth(month).cost());
    }

    public synchronized UsageStats stats() {
        if (!Files.exists(file)) {
            return UsageStats.empty();
        }
        try {
            return objectMapper.readValue(file.toFile(), UsageStats.class);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read usage statistics from " + file, ex);
        }
    }

    public Path file() {
        return file;
    }

    private void write(UsageStats stats) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), stats);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write usage statistics to " + file, ex);
        }
    }
}
