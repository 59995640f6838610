package ai.photodesk.batch.alttext;

import java.util.Objects;

/**
 * Result of a live API key check.
 */
public record ApiKeyValidation(boolean valid, String message) {

    public ApiKeyValidation {
        message = Objects.requireNonNull(message, "message");
    }

    static ApiKeyValidation valid(String message) {
        return new ApiKeyValidation(true, message);
    }

    static ApiKeyValidation invalid(String message) {
        return new ApiKeyValidation(false, message);
    }
}
