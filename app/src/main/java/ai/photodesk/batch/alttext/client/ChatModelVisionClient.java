package ai.photodesk.batch.alttext.client;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link VisionClient} backed by any multimodal LangChain4j {@link ChatModel}.
 */
public class ChatModelVisionClient implements VisionClient {

    private final ChatModel model;
    private final String modelName;

    public ChatModelVisionClient(ChatModel model, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
    }

    @Override
    public String describe(VisionRequest request) {
        Objects.requireNonNull(request, "request");
        List<ChatMessage> messages = new ArrayList<>();
        if (!request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(
                ImageContent.from(request.base64Image(), request.mediaType()),
                TextContent.from(request.userPrompt())));
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(messages)
                .maxOutputTokens(request.maxTokens())
                .build();

        ChatResponse response;
        try {
            response = model.chat(chatRequest);
        } catch (RuntimeException ex) {
            throw translate(ex);
        }
        AiMessage aiMessage = response == null ? null : response.aiMessage();
        String text = aiMessage == null ? null : aiMessage.text();
        if (text == null || text.isBlank()) {
            throw new VisionApiException(VisionFailure.INVALID_RESPONSE, "No content in API response");
        }
        return text.strip();
    }

    private VisionApiException translate(RuntimeException ex) {
        // RateLimitException is itself retriable in LangChain4j, so it is matched first
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return new VisionApiException(VisionFailure.RATE_LIMITED, "Rate limited by API", ex);
            }
            if (cause instanceof AuthenticationException) {
                return new VisionApiException(VisionFailure.AUTHENTICATION,
                        "Invalid API key - please check your API key", ex);
            }
            if (cause instanceof ModelNotFoundException) {
                return new VisionApiException(VisionFailure.MODEL_NOT_FOUND,
                        "Model not found - '" + modelName + "' is not available", ex);
            }
            if (cause instanceof RetriableException) {
                return new VisionApiException(VisionFailure.TRANSIENT, describeCause(cause), ex);
            }
            cause = cause.getCause();
        }
        return new VisionApiException(VisionFailure.CLIENT_ERROR, describeCause(ex), ex);
    }

    private static String describeCause(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }
}
