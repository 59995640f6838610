package ai.photodesk.batch.config;

import java.util.Optional;

/**
 * API credentials. Any of them may be absent, which disables the matching provider.
 */
public record Secrets(Optional<String> anthropicApiKey, Optional<String> geminiApiKey) {

    public Secrets {
        anthropicApiKey = normalize(anthropicApiKey);
        geminiApiKey = normalize(geminiApiKey);
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty());
    }

    public Optional<String> apiKeyFor(VisionProvider provider) {
        return switch (provider) {
            case ANTHROPIC -> anthropicApiKey;
            case GEMINI -> geminiApiKey;
        };
    }

    @Override
    public String toString() {
        return "Secrets[anthropicApiKey=" + mask(anthropicApiKey) + ", geminiApiKey=" + mask(geminiApiKey) + "]";
    }

    private static Optional<String> normalize(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::trim).filter(s -> !s.isEmpty());
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "****" : "<none>";
    }
}
