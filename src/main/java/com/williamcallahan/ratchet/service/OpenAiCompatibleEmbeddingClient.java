package com.williamcallahan.ratchet.service;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding client for any OpenAI-compatible {@code /embeddings} endpoint.
 *
 * <p>Makes exactly one provider call per message. Failures surface as
 * {@link EmbeddingServiceUnavailableException}; retrying is left to the job queue.</p>
 */
public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_ERROR_SNIPPET = 512;

    private final OpenAIClient client;
    private final String modelName;
    private final int dimensions;

    /**
     * Creates a client against a remote endpoint.
     *
     * @param baseUrl API root; {@code /v1} is appended when missing
     * @param apiKey provider API key
     * @param modelName embedding model identifier
     * @param dimensions requested vector size, must match the {@code messages.embedding} column
     * @return configured client
     */
    public static OpenAiCompatibleEmbeddingClient create(String baseUrl, String apiKey, String modelName, int dimensions) {
        validateDimensions(dimensions);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Embedding API key is not configured (ratchet.embedding.api-key)");
        }
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(normalizeBaseUrl(baseUrl))
                .build();
        return new OpenAiCompatibleEmbeddingClient(client, requireModel(modelName), dimensions);
    }

    static OpenAiCompatibleEmbeddingClient create(OpenAIClient client, String modelName, int dimensions) {
        validateDimensions(dimensions);
        return new OpenAiCompatibleEmbeddingClient(Objects.requireNonNull(client, "client"), requireModel(modelName), dimensions);
    }

    private OpenAiCompatibleEmbeddingClient(OpenAIClient client, String modelName, int dimensions) {
        this.client = client;
        this.modelName = modelName;
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        EmbeddingCreateParams params = EmbeddingCreateParams.builder()
                .model(modelName)
                .inputOfArrayOfStrings(List.of(Objects.requireNonNullElse(text, "")))
                .dimensions((long) dimensions)
                .build();
        RequestOptions options = RequestOptions.builder()
                .timeout(Timeout.builder()
                        .connect(CONNECT_TIMEOUT)
                        .read(REQUEST_TIMEOUT)
                        .request(REQUEST_TIMEOUT)
                        .build())
                .build();
        CreateEmbeddingResponse response;
        try {
            response = client.embeddings().create(params, options);
        } catch (OpenAIServiceException serviceException) {
            throw new EmbeddingServiceUnavailableException("Embedding provider returned HTTP "
                    + serviceException.statusCode() + ": " + sanitize(serviceException.getMessage()), serviceException);
        } catch (OpenAIException sdkException) {
            throw new EmbeddingServiceUnavailableException(
                    "Embedding request failed: " + sanitize(sdkException.getMessage()), sdkException);
        }
        return parseResponse(response);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private float[] parseResponse(CreateEmbeddingResponse response) {
        if (response == null || response.data().isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Embedding response contained no vectors");
        }
        Embedding first = response.data().get(0);
        List<Double> values = first.embedding();
        if (values == null || values.size() != dimensions) {
            throw new EmbeddingServiceUnavailableException("Embedding dimension mismatch: expected " + dimensions
                    + " but received " + (values == null ? 0 : values.size()));
        }
        float[] vector = new float[values.size()];
        for (int index = 0; index < values.size(); index++) {
            Double value = values.get(index);
            if (value == null) {
                throw new EmbeddingServiceUnavailableException("Embedding response has a null value at index " + index);
            }
            vector[index] = value.floatValue();
        }
        log.debug("[EMBEDDING] Received {}-dimension vector from {}", vector.length, modelName);
        return vector;
    }

    static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Embedding base URL is not configured (ratchet.embedding.base-url)");
        }
        String trimmed = baseUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith("/embeddings")) {
            trimmed = trimmed.substring(0, trimmed.length() - "/embeddings".length());
        }
        return trimmed.endsWith("/v1") ? trimmed : trimmed + "/v1";
    }

    private static void validateDimensions(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
    }

    private static String requireModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalStateException("Embedding model is not configured (ratchet.embedding.model)");
        }
        return modelName.trim();
    }

    private static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "no details";
        }
        String flattened = message.replace("\r", " ").replace("\n", " ").trim();
        return flattened.length() > MAX_ERROR_SNIPPET ? flattened.substring(0, MAX_ERROR_SNIPPET) + "..." : flattened;
    }

    @Override
    public void close() {
        client.close();
    }
}
