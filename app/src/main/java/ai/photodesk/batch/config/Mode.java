package ai.photodesk.batch.config;

import java.util.Locale;

/**
 * What a CLI invocation does.
 */
public enum Mode {
    PROCESS,
    VALIDATE_KEY,
    ESTIMATE_COST;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PROCESS;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }
}
