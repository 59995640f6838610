package ai.photodesk.batch.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileUsageTrackerTest {

    private static final Clock MARCH = Clock.fixed(Instant.parse("2025-03-15T10:00:00Z"), ZoneOffset.UTC);
    private static final Clock APRIL = Clock.fixed(Instant.parse("2025-04-02T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void startsEmptyWhenNoFileExists() {
        JsonFileUsageTracker tracker = new JsonFileUsageTracker(tempDir.resolve("usage.json"), MARCH);

        assertThat(tracker.stats()).isEqualTo(UsageStats.empty());
    }

    @Test
    void accumulatesTotalsAndMonthlyCounters() {
        Path file = tempDir.resolve("stats/usage.json");
        JsonFileUsageTracker march = new JsonFileUsageTracker(file, MARCH);
        march.recordUsage(new BigDecimal("0.006"));
        march.recordUsage(new BigDecimal("0.006"));
        new JsonFileUsageTracker(file, APRIL).recordUsage(new BigDecimal("0.006"));

        UsageStats stats = new JsonFileUsageTracker(file, MARCH).stats();

        assertThat(Files.exists(file)).isTrue();
        assertThat(stats.total().requests()).isEqualTo(3);
        assertThat(stats.total().cost()).isEqualByComparingTo("0.018");
        assertThat(stats.forMonth("2025-03").requests()).isEqualTo(2);
        assertThat(stats.forMonth("2025-03").cost()).isEqualByComparingTo("0.012");
        assertThat(stats.forMonth("2025-04").requests()).isEqualTo(1);
        assertThat(stats.forMonth("2025-05")).isEqualTo(UsageStats.Counter.ZERO);
    }

    @Test
    void unreadableFileIsReported() throws IOException {
        Path file = Files.writeString(tempDir.resolve("usage.json"), "{not json");
        JsonFileUsageTracker tracker = new JsonFileUsageTracker(file, MARCH);

        Throwable thrown = catchThrowable(() -> tracker.recordUsage(BigDecimal.ONE));

        assertThat(thrown).isInstanceOf(UncheckedIOException.class).hasMessageContaining("usage.json");
    }
}
