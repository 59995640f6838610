package ai.photodesk.batch.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        List<Path> inputs,
        boolean recursive,
        String presetName,
        Path outputFolder,
        boolean generateAltText,
        Optional<String> filenameTemplate,
        LogFormat logFormat,
        VisionConfig visionConfig,
        Secrets secrets,
        AltTextSettings altTextSettings,
        long maxSourceFileBytes,
        Optional<Path> usageStatsFile
) {

    public Config {
        mode = Objects.requireNonNull(mode, "mode");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        presetName = requireNonBlank(presetName, "presetName");
        outputFolder = Objects.requireNonNull(outputFolder, "outputFolder");
        filenameTemplate = filenameTemplate == null ? Optional.empty() : filenameTemplate.filter(value -> !value.isBlank());
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        visionConfig = Objects.requireNonNull(visionConfig, "visionConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        altTextSettings = Objects.requireNonNull(altTextSettings, "altTextSettings");
        if (maxSourceFileBytes < 1) {
            throw new IllegalArgumentException("maxSourceFileBytes must be positive");
        }
        usageStatsFile = usageStatsFile == null ? Optional.empty() : usageStatsFile;
        if (mode == Mode.PROCESS && inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one input file or folder must be provided");
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
