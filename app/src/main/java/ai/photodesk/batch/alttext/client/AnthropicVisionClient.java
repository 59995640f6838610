package ai.photodesk.batch.alttext.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VisionClient} speaking the Anthropic Messages API directly over {@link HttpClient}.
 */
public class AnthropicVisionClient implements VisionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnthropicVisionClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String API_VERSION = "2023-06-01";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final double TEMPERATURE = 0.3;
    private static final int ERROR_BODY_LIMIT = 100;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI messagesUri;
    private final String apiKey;
    private final String modelName;
    private final Duration requestTimeout;

    public AnthropicVisionClient(String apiKey, String modelName, String baseUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_CONNECT_TIMEOUT).build(), new ObjectMapper(),
                apiKey, modelName, baseUrl, requestTimeout);
    }

    public AnthropicVisionClient(HttpClient httpClient, ObjectMapper objectMapper, String apiKey, String modelName,
                                 String baseUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.apiKey = requireNonBlank(apiKey, "apiKey");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.messagesUri = URI.create(stripTrailingSlash(baseUrl == null ? DEFAULT_BASE_URL : baseUrl) + "/v1/messages");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public String describe(VisionRequest request) {
        Objects.requireNonNull(request, "request");
        HttpRequest httpRequest = HttpRequest.newBuilder(messagesUri)
                .timeout(requestTimeout)
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJsonPayload(request), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException ex) {
            throw new VisionApiException(VisionFailure.TRANSIENT, "Request timeout - network may be slow", ex);
        } catch (IOException ex) {
            throw new VisionApiException(VisionFailure.TRANSIENT, "Network error: " + ex.getClass().getSimpleName(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VisionApiException(VisionFailure.INTERRUPTED, "Interrupted while calling the vision API", ex);
        }
        return handleResponse(response);
    }

    private String handleResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 200) {
            return extractText(response.body());
        }
        String body = response.body() == null ? "" : response.body();
        LOGGER.debug("Anthropic API returned {}: {}", status, body);
        if (status == 429) {
            Optional<Duration> retryAfter = response.headers().firstValue("retry-after")
                    .flatMap(AnthropicVisionClient::parseRetryAfter);
            throw VisionApiException.rateLimited(retryAfter);
        }
        if (status == 401) {
            throw VisionApiException.httpStatus(VisionFailure.AUTHENTICATION, status,
                    "Invalid API key - please check your API key");
        }
        if (status == 404) {
            throw VisionApiException.httpStatus(VisionFailure.MODEL_NOT_FOUND, status,
                    "Model not found - '" + modelName + "' may be deprecated");
        }
        if (status >= 500) {
            throw VisionApiException.httpStatus(VisionFailure.TRANSIENT, status, "Anthropic server error: " + status);
        }
        throw VisionApiException.httpStatus(VisionFailure.CLIENT_ERROR, status,
                "API error " + status + ": " + truncate(body));
    }

    private String extractText(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            throw new VisionApiException(VisionFailure.INVALID_RESPONSE, "Malformed API response", ex);
        }
        JsonNode content = root == null ? null : root.path("content");
        if (content != null && content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                    String text = block.get("text").asText().strip();
                    if (!text.isEmpty()) {
                        return text;
                    }
                }
            }
        }
        throw new VisionApiException(VisionFailure.INVALID_RESPONSE, "No content in API response");
    }

    String toJsonPayload(VisionRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", modelName);
        payload.put("max_tokens", request.maxTokens());
        payload.put("temperature", TEMPERATURE);
        if (!request.systemPrompt().isBlank()) {
            payload.put("system", request.systemPrompt());
        }
        ArrayNode messages = payload.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        ObjectNode image = content.addObject();
        image.put("type", "image");
        ObjectNode source = image.putObject("source");
        source.put("type", "base64");
        source.put("media_type", request.mediaType());
        source.put("data", request.base64Image());
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", request.userPrompt());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize vision request", ex);
        }
    }

    static Optional<Duration> parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException ex) {
            LOGGER.debug("Ignoring non-numeric retry-after header '{}'", value);
            return Optional.empty();
        }
    }

    private static String truncate(String body) {
        return body.length() <= ERROR_BODY_LIMIT ? body : body.substring(0, ERROR_BODY_LIMIT);
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
