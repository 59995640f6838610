package ai.photodesk.batch.alttext.client;

import ai.photodesk.batch.config.VisionConfig;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link VisionClient} for the configured provider.
 */
public final class VisionClientFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisionClientFactory.class);

    private VisionClientFactory() {
    }

    public static VisionClient create(VisionConfig visionConfig, String apiKey, Duration requestTimeout) {
        Objects.requireNonNull(visionConfig, "visionConfig");
        return switch (visionConfig.provider()) {
            case ANTHROPIC -> {
                LOGGER.info("Using Anthropic model '{}'", visionConfig.modelName());
                yield new AnthropicVisionClient(apiKey, visionConfig.modelName(),
                        visionConfig.baseUrl().orElse(AnthropicVisionClient.DEFAULT_BASE_URL), requestTimeout);
            }
            case GEMINI -> new ChatModelVisionClient(createGeminiChatModel(visionConfig, apiKey, requestTimeout),
                    visionConfig.modelName());
        };
    }

    private static ChatModel createGeminiChatModel(VisionConfig visionConfig, String apiKey, Duration requestTimeout) {
        try {
            LOGGER.info("Using Gemini model '{}'", visionConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(visionConfig.modelName())
                    .temperature(AnthropicVisionClient.TEMPERATURE)
                    .timeout(requestTimeout)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
