package ai.photodesk.batch.alttext.client;

import java.util.Objects;

/**
 * One image description request: a base64 image plus the system and user prompts.
 */
public record VisionRequest(String base64Image, String mediaType, String systemPrompt, String userPrompt, int maxTokens) {

    public VisionRequest {
        base64Image = Objects.requireNonNull(base64Image, "base64Image");
        mediaType = Objects.requireNonNull(mediaType, "mediaType");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        userPrompt = Objects.requireNonNull(userPrompt, "userPrompt");
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        }
    }

    @Override
    public String toString() {
        return "VisionRequest[mediaType=" + mediaType + ", imageChars=" + base64Image.length()
                + ", userPrompt=" + userPrompt + ", maxTokens=" + maxTokens + "]";
    }
}
