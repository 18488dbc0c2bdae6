package com.catalog.matching.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Embedding provider for OpenAI-compatible {@code /v1/embeddings} endpoints.
 *
 * Usage:
 * <pre>
 * HttpEmbeddingProvider provider = HttpEmbeddingProvider.builder()
 *     .baseUrl("https://api.openai.com")
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("text-embedding-ada-002")
 *     .build();
 * </pre>
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingProvider.class);

    private static final String DEFAULT_BASE_URL = "https://api.openai.com";
    private static final String DEFAULT_MODEL = "text-embedding-ada-002";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimensions;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpEmbeddingProvider(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.apiKey = builder.apiKey;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.dimensions = builder.dimensions;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            String body = objectMapper.writeValueAsString(new EmbeddingRequest(model, texts));
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body));
            if (apiKey != null && !apiKey.isBlank()) {
                request.header("Authorization", "Bearer " + apiKey);
            }

            log.debug("Requesting {} embeddings from {} (model {})", texts.size(), baseUrl, model);
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EmbeddingException("Embedding endpoint returned status " + response.statusCode());
            }

            EmbeddingResponse parsed = objectMapper.readValue(response.body(), EmbeddingResponse.class);
            return toVectors(parsed, texts.size());
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while requesting embeddings", e);
        }
    }

    @Override
    public String getProviderName() {
        return "Http/" + model;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    private List<float[]> toVectors(EmbeddingResponse response, int expected) {
        if (response.data() == null || response.data().size() != expected) {
            throw new EmbeddingException("Expected " + expected + " embeddings, got "
                    + (response.data() == null ? 0 : response.data().size()));
        }
        List<EmbeddingData> ordered = new ArrayList<>(response.data());
        ordered.sort(Comparator.comparingInt(EmbeddingData::index));

        List<float[]> vectors = new ArrayList<>(expected);
        for (EmbeddingData data : ordered) {
            if (data.embedding() == null || data.embedding().isEmpty()) {
                throw new EmbeddingException("Empty embedding at index " + data.index());
            }
            if (dimensions > 0 && data.embedding().size() != dimensions) {
                throw new EmbeddingException("Expected " + dimensions + " dimensions, got " + data.embedding().size());
            }
            float[] vector = new float[data.embedding().size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = data.embedding().get(i).floatValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private String model;
        private int dimensions;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /**
         * Expected vector size; 0 accepts whatever the endpoint returns.
         */
        public Builder dimensions(int dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpEmbeddingProvider build() {
            return new HttpEmbeddingProvider(this);
        }
    }

    // Request/Response DTOs for the embeddings API
    private record EmbeddingRequest(String model, List<String> input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(List<EmbeddingData> data, String model) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingData(int index, List<Double> embedding) {}
}
