package ai.photodesk.batch.config;

import java.util.Locale;

/**
 * Remote vision APIs able to describe an image.
 */
public enum VisionProvider {
    ANTHROPIC,
    GEMINI;

    public static VisionProvider from(String value) {
        if (value == null) {
            return ANTHROPIC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "anthropic", "claude", "" -> ANTHROPIC;
            case "gemini" -> GEMINI;
            default -> throw new IllegalArgumentException("Unsupported vision provider: " + value);
        };
    }

    public String defaultModel() {
        return switch (this) {
            case ANTHROPIC -> "claude-sonnet-4-5";
            case GEMINI -> "gemini-2.5-flash";
        };
    }
}
