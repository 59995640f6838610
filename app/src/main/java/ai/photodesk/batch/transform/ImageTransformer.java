package ai.photodesk.batch.transform;

import java.nio.file.Path;

/**
 * Loads one image, renders it with a preset and writes the result.
 * One instance holds at most one decoded image; {@link #release()} drops it.
 */
public interface ImageTransformer {

    /**
     * @return {@code false} when the file is missing, unsupported, outside the size limits or undecodable
     */
    boolean loadImage(Path source);

    /**
     * Applies the preset to the loaded image and writes it to {@code outputPath}.
     *
     * @return the written file
     * @throws TransformException when nothing is loaded or the output cannot be produced
     */
    Path process(Preset preset, Path outputPath);

    void release();
}
