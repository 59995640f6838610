package ai.photodesk.batch.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Which vision model describes images, and where it is reached.
 */
public record VisionConfig(VisionProvider provider, String modelName, Optional<String> baseUrl) {

    public VisionConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    public static VisionConfig defaults(VisionProvider provider) {
        return new VisionConfig(provider, provider.defaultModel(), Optional.empty());
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
