package ai.photodesk.batch.transform;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import javax.imageio.ImageIO;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ImageTransformer} backed by ImageIO for decoding and Thumbnailator for resizing and encoding.
 */
public class ThumbnailatorImageTransformer implements ImageTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ThumbnailatorImageTransformer.class);

    public static final long MIN_SOURCE_FILE_BYTES = 1024L;
    public static final long DEFAULT_MAX_SOURCE_FILE_BYTES = 15L * 1024 * 1024;

    static final float TARGET_SIZE_START_QUALITY = 0.95f;
    static final float TARGET_SIZE_MIN_QUALITY = 0.10f;
    static final float TARGET_SIZE_QUALITY_STEP = 0.05f;

    private final long maxSourceFileBytes;
    private BufferedImage image;
    private Path source;

    public ThumbnailatorImageTransformer() {
        this(DEFAULT_MAX_SOURCE_FILE_BYTES);
    }

    public ThumbnailatorImageTransformer(long maxSourceFileBytes) {
        if (maxSourceFileBytes < MIN_SOURCE_FILE_BYTES) {
            throw new IllegalArgumentException("maxSourceFileBytes must be at least " + MIN_SOURCE_FILE_BYTES);
        }
        this.maxSourceFileBytes = maxSourceFileBytes;
    }

    @Override
    public boolean loadImage(Path path) {
        release();
        if (path == null || !Files.isRegularFile(path)) {
            LOGGER.warn("Image not found: {}", path);
            return false;
        }
        if (!SupportedImageTypes.isSupported(path)) {
            LOGGER.warn("Unsupported image type: {}", path);
            return false;
        }
        try {
            long size = Files.size(path);
            if (size < MIN_SOURCE_FILE_BYTES || size > maxSourceFileBytes) {
                LOGGER.warn("Image {} has size {} bytes outside the accepted range {}-{}", path, size,
                        MIN_SOURCE_FILE_BYTES, maxSourceFileBytes);
                return false;
            }
            BufferedImage decoded = ImageIO.read(path.toFile());
            if (decoded == null) {
                LOGGER.warn("No image reader could decode {}", path);
                return false;
            }
            this.image = flattenOntoWhite(decoded);
            this.source = path;
            LOGGER.debug("Loaded {} ({}x{})", path, image.getWidth(), image.getHeight());
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Failed to read image {}: {}", path, ex.getMessage());
            return false;
        }
    }

    @Override
    public Path process(Preset preset, Path outputPath) {
        Objects.requireNonNull(preset, "preset");
        Objects.requireNonNull(outputPath, "outputPath");
        if (image == null) {
            throw new TransformException("No image loaded");
        }
        try {
            BufferedImage resized = resize(image, preset);
            byte[] encoded = encode(resized, preset);
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outputPath, encoded);
            LOGGER.debug("Wrote {} ({}x{}, {} bytes) from {}", outputPath, resized.getWidth(), resized.getHeight(),
                    encoded.length, source);
            return outputPath;
        } catch (IOException ex) {
            throw new TransformException("Failed to write " + outputPath + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void release() {
        if (image != null) {
            image.flush();
        }
        image = null;
        source = null;
    }

    private BufferedImage resize(BufferedImage input, Preset preset) throws IOException {
        if (preset.resizeMode() == ResizeMode.EXACT) {
            return Thumbnails.of(input)
                    .size(preset.width(), preset.height())
                    .crop(Positions.CENTER)
                    .asBufferedImage();
        }
        if (input.getWidth() <= preset.width() && input.getHeight() <= preset.height()) {
            return input;
        }
        return Thumbnails.of(input)
                .size(preset.width(), preset.height())
                .keepAspectRatio(true)
                .asBufferedImage();
    }

    private byte[] encode(BufferedImage resized, Preset preset) throws IOException {
        if (!preset.format().supportsQuality()) {
            return write(resized, preset.format(), 1.0f);
        }
        if (preset.targetSizeKb().isEmpty()) {
            return write(resized, preset.format(), preset.quality() / 100f);
        }
        long targetBytes = preset.targetSizeKb().getAsInt() * 1024L;
        byte[] encoded = null;
        // integer steps so the 0.10 floor is always tried
        int startStep = Math.round(TARGET_SIZE_START_QUALITY / TARGET_SIZE_QUALITY_STEP);
        int minStep = Math.round(TARGET_SIZE_MIN_QUALITY / TARGET_SIZE_QUALITY_STEP);
        for (int step = startStep; step >= minStep; step--) {
            float quality = step * TARGET_SIZE_QUALITY_STEP;
            encoded = write(resized, preset.format(), quality);
            if (encoded.length <= targetBytes) {
                LOGGER.debug("Reached target size {} KB at quality {}", preset.targetSizeKb().getAsInt(), quality);
                return encoded;
            }
        }
        LOGGER.info("Could not reach target size {} KB for {}; keeping {} bytes", preset.targetSizeKb().getAsInt(),
                source, encoded.length);
        return encoded;
    }

    private byte[] write(BufferedImage resized, ImageFormat format, float quality) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(resized)
                .scale(1.0)
                .outputFormat(format.extension());
        if (format.supportsQuality()) {
            builder.outputQuality(quality);
        }
        builder.toOutputStream(out);
        return out.toByteArray();
    }

    public static BufferedImage flattenOntoWhite(BufferedImage decoded) {
        if (decoded.getType() == BufferedImage.TYPE_INT_RGB) {
            return decoded;
        }
        BufferedImage rgb = new BufferedImage(decoded.getWidth(), decoded.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            graphics.drawImage(decoded, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
