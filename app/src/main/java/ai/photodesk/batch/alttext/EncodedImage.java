package ai.photodesk.batch.alttext;

import java.util.Objects;

/**
 * Base64 payload ready to be sent to a vision API.
 */
public record EncodedImage(String base64Data, String mediaType) {

    public EncodedImage {
        base64Data = Objects.requireNonNull(base64Data, "base64Data");
        mediaType = Objects.requireNonNull(mediaType, "mediaType");
    }
}
