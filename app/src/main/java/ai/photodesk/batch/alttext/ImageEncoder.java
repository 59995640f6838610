package ai.photodesk.batch.alttext;

import ai.photodesk.batch.transform.ThumbnailatorImageTransformer;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import javax.imageio.ImageIO;
import net.coobird.thumbnailator.Thumbnails;

/**
 * Prepares images for the vision API: RGB on white, longest side at most {@value #MAX_DIMENSION} px, JPEG.
 */
public class ImageEncoder {

    public static final int MAX_DIMENSION = 2048;
    public static final float JPEG_QUALITY = 0.85f;
    public static final String MEDIA_TYPE = "image/jpeg";

    private final int maxDimension;
    private final float quality;

    public ImageEncoder() {
        this(MAX_DIMENSION, JPEG_QUALITY);
    }

    public ImageEncoder(int maxDimension, float quality) {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive");
        }
        if (quality <= 0f || quality > 1f) {
            throw new IllegalArgumentException("quality must be in (0, 1]");
        }
        this.maxDimension = maxDimension;
        this.quality = quality;
    }

    public EncodedImage encode(Path imagePath) {
        if (imagePath == null || !Files.isRegularFile(imagePath)) {
            throw new ImageEncodingException("Image file not found: " + imagePath);
        }
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(imagePath.toFile());
        } catch (IOException ex) {
            throw new ImageEncodingException("Failed to read image " + imagePath.getFileName() + ": " + ex.getMessage(), ex);
        }
        if (decoded == null) {
            throw new ImageEncodingException("Failed to encode image: unsupported or corrupt file " + imagePath.getFileName());
        }
        return encode(decoded);
    }

    EncodedImage encode(BufferedImage image) {
        BufferedImage rgb = ThumbnailatorImageTransformer.flattenOntoWhite(image);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(rgb);
            if (rgb.getWidth() > maxDimension || rgb.getHeight() > maxDimension) {
                builder.size(maxDimension, maxDimension).keepAspectRatio(true);
            } else {
                builder.scale(1.0);
            }
            builder.outputFormat("jpg")
                    .outputQuality(quality)
                    .toOutputStream(out);
        } catch (IOException ex) {
            throw new ImageEncodingException("Failed to encode image: " + ex.getMessage(), ex);
        }
        return new EncodedImage(Base64.getEncoder().encodeToString(out.toByteArray()), MEDIA_TYPE);
    }

    /**
     * Smallest valid payload, used to probe an API key.
     */
    public EncodedImage blankProbe() {
        BufferedImage pixel = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = pixel.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, 1, 1);
        } finally {
            graphics.dispose();
        }
        return encode(pixel);
    }
}
