package ch.so.arp.rag.assistant;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link EmbeddingClient} backed by the Yandex Foundation Models
 * {@code textEmbedding} endpoint. One request per text, no retries.
 */
class YandexEmbeddingClient implements EmbeddingClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(YandexEmbeddingClient.class);

    private final RestClient restClient;
    private final YandexCloudProperties properties;
    private volatile int dimension;

    YandexEmbeddingClient(RestClient restClient, YandexCloudProperties properties) {
        properties.requireCredentials();
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.properties = properties;
        this.dimension = properties.embedDimension();
        LOGGER.info("Yandex embeddings with model {} ({}), assumed dimension {}", properties.embedModel(),
                properties.embedModelUri(), dimension);
    }

    @Override
    public float[] embed(String text) {
        String input = text == null ? "" : text;
        if (input.length() > properties.maxEmbedChars()) {
            LOGGER.warn("Embedding input truncated from {} to {} characters", input.length(),
                    properties.maxEmbedChars());
            input = input.substring(0, properties.maxEmbedChars());
        }
        LOGGER.debug("Requesting embedding for {} characters", input.length());

        EmbeddingRequest request = new EmbeddingRequest(properties.embedModelUri(), input);
        EmbeddingResponse response = UpstreamCalls.call("Yandex embeddings", () -> restClient.post()
                .uri("/textEmbedding")
                .header(HttpHeaders.AUTHORIZATION, "Api-Key " + properties.apiKey())
                .header("x-folder-id", properties.folderId())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(EmbeddingResponse.class));

        if (response == null || response.embedding() == null || response.embedding().length == 0) {
            throw new MalformedUpstreamResponseException("Yandex embeddings response has no 'embedding' field");
        }
        float[] embedding = response.embedding();
        if (embedding.length != dimension) {
            LOGGER.info("Embedding dimension updated from {} to {}", dimension, embedding.length);
            dimension = embedding.length;
        }
        return embedding;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return properties.embedModel();
    }

    record EmbeddingRequest(String modelUri, String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(float[] embedding, String numTokens, String modelVersion) {
    }
}
