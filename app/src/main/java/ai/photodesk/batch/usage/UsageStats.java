package ai.photodesk.batch.usage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Accumulated request counts and costs, overall and per calendar month ({@code yyyy-MM}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageStats(Counter total, Map<String, Counter> monthly) {

    public UsageStats {
        total = total == null ? Counter.ZERO : total;
        monthly = monthly == null ? Map.of() : Map.copyOf(monthly);
    }

    public static UsageStats empty() {
        return new UsageStats(Counter.ZERO, Map.of());
    }

    public UsageStats add(String month, BigDecimal cost) {
        Objects.requireNonNull(month, "month");
        Objects.requireNonNull(cost, "cost");
        Map<String, Counter> updated = new TreeMap<>(monthly);
        updated.merge(month, Counter.ZERO.add(cost), Counter::plus);
        return new UsageStats(total.add(cost), updated);
    }

    public Counter forMonth(String month) {
        return monthly.getOrDefault(month, Counter.ZERO);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Counter(long requests, BigDecimal cost) {

        public static final Counter ZERO = new Counter(0, BigDecimal.ZERO);

        public Counter {
            if (requests < 0) {
                throw new IllegalArgumentException("requests must not be negative");
            }
            cost = cost == null ? BigDecimal.ZERO : cost;
        }

        Counter add(BigDecimal amount) {
            return new Counter(requests + 1, cost.add(amount));
        }

        Counter plus(Counter other) {
            return new Counter(requests + other.requests, cost.add(other.cost));
        }
    }
}
