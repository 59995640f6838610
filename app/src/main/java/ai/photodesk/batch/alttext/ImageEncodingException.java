package ai.photodesk.batch.alttext;

/**
 * Runtime exception raised when an image cannot be prepared for the vision API.
 */
public class ImageEncodingException extends RuntimeException {

    public ImageEncodingException(String message) {
        super(message);
    }

    public ImageEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
