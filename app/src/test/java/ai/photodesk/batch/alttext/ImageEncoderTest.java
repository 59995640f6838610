package ai.photodesk.batch.alttext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.photodesk.batch.testing.TestImages;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Base64;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageEncoderTest {

    @TempDir
    Path tempDir;

    private final ImageEncoder encoder = new ImageEncoder();

    @Test
    void downscalesLargeImagesToTheMaximumDimension() throws IOException {
        Path source = TestImages.gradientJpeg(tempDir, "wide.jpg", 3000, 1000);

        EncodedImage encoded = encoder.encode(source);
        BufferedImage decoded = decode(encoded);

        assertThat(encoded.mediaType()).isEqualTo("image/jpeg");
        assertThat(decoded.getWidth()).isEqualTo(ImageEncoder.MAX_DIMENSION);
        assertThat(decoded.getHeight()).isBetween(680, 684);
    }

    @Test
    void keepsSmallImagesAtTheirSize() throws IOException {
        Path source = TestImages.gradientJpeg(tempDir, "small.jpg", 320, 200);

        BufferedImage decoded = decode(encoder.encode(source));

        assertThat(decoded.getWidth()).isEqualTo(320);
        assertThat(decoded.getHeight()).isEqualTo(200);
    }

    @Test
    void flattensTransparencyOntoWhite() throws IOException {
        Path source = TestImages.halfTransparentPng(tempDir, "alpha.png", 200, 100);

        BufferedImage decoded = decode(encoder.encode(source));
        Color pixel = new Color(decoded.getRGB(20, 50));

        assertThat(pixel.getRed()).isGreaterThan(240);
        assertThat(pixel.getGreen()).isGreaterThan(240);
        assertThat(pixel.getBlue()).isGreaterThan(240);
    }

    @Test
    void rejectsMissingAndCorruptFiles() {
        Path corrupt = TestImages.corrupt(tempDir, "broken.jpg");

        assertThatThrownBy(() -> encoder.encode(tempDir.resolve("missing.jpg")))
                .isInstanceOf(ImageEncodingException.class)
                .hasMessageStartingWith("Image file not found");
        assertThatThrownBy(() -> encoder.encode(corrupt))
                .isInstanceOf(ImageEncodingException.class)
                .hasMessageContaining("broken.jpg");
    }

    @Test
    void blankProbeIsAValidJpeg() throws IOException {
        BufferedImage decoded = decode(encoder.blankProbe());

        assertThat(decoded.getWidth()).isEqualTo(1);
        assertThat(decoded.getHeight()).isEqualTo(1);
    }

    private static BufferedImage decode(EncodedImage encoded) throws IOException {
        byte[] bytes = Base64.getDecoder().decode(encoded.base64Data());
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        assertThat(image).isNotNull();
        return image;
    }
}
