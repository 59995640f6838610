package ai.photodesk.batch.transform;

import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Named output profile: target box, optional file-size goal, format and quality.
 */
public record Preset(
        String key,
        String displayName,
        ResizeMode resizeMode,
        int width,
        int height,
        OptionalInt targetSizeKb,
        ImageFormat format,
        int quality
) {

    public Preset {
        key = requireNonBlank(key, "key");
        displayName = requireNonBlank(displayName, "displayName");
        resizeMode = Objects.requireNonNull(resizeMode, "resizeMode");
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        targetSizeKb = targetSizeKb == null ? OptionalInt.empty() : targetSizeKb;
        format = Objects.requireNonNull(format, "format");
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be between 1 and 100");
        }
    }

    /**
     * Default output file name: {@code <stem>_<preset key>.<extension>}.
     */
    public String suggestedFilename(Path source) {
        return SupportedImageTypes.stemOf(source) + "_" + key + "." + format.extension();
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
