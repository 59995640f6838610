package ai.photodesk.batch.alttext;

import java.nio.file.Path;

/**
 * Progress of the alt-text phase after one request resolved.
 */
public record AltTextProgress(int completed, int total, Path path, AltTextStatus status) {
}
