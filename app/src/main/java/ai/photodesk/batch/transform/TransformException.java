package ai.photodesk.batch.transform;

/**
 * Runtime exception raised when an image cannot be transformed or written.
 */
public class TransformException extends RuntimeException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
