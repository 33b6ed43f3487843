package ch.so.arp.rag.assistant;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link CompletionClient} calling the YandexGPT {@code completion} endpoint.
 * The API has no system role, system messages are sent as user messages
 * carrying a {@value #SYSTEM_PREFIX} prefix.
 */
class YandexGptClient implements CompletionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(YandexGptClient.class);

    static final String SYSTEM_PREFIX = "System instruction: ";

    private final RestClient restClient;
    private final YandexCloudProperties properties;

    YandexGptClient(RestClient restClient, YandexCloudProperties properties) {
        properties.requireCredentials();
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.properties = properties;
        LOGGER.info("YandexGPT with model {} ({})", properties.chatModel(), properties.chatModelUri());
    }

    @Override
    public String complete(List<ChatMessage> messages, double temperature, int maxTokens) {
        CompletionRequest request = new CompletionRequest(properties.chatModelUri(),
                new CompletionOptions(false, temperature, maxTokens),
                messages.stream().map(YandexGptClient::toWireMessage).toList());
        LOGGER.debug("Sending {} messages to YandexGPT", request.messages().size());

        CompletionResponse response = UpstreamCalls.call("YandexGPT", () -> restClient.post()
                .uri("/completion")
                .header(HttpHeaders.AUTHORIZATION, "Api-Key " + properties.apiKey())
                .header("x-folder-id", properties.folderId())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(CompletionResponse.class));

        String answer = extractAnswer(response);
        LOGGER.info("Answer received from YandexGPT, length: {} characters", answer.length());
        return answer;
    }

    @Override
    public String modelName() {
        return properties.chatModel();
    }

    private static WireMessage toWireMessage(ChatMessage message) {
        if (message.role() == ChatMessage.Role.SYSTEM) {
            return new WireMessage(ChatMessage.Role.USER.wireName(), SYSTEM_PREFIX + message.content());
        }
        return new WireMessage(message.role().wireName(), message.content());
    }

    private static String extractAnswer(CompletionResponse response) {
        if (response == null || response.result() == null || response.result().alternatives() == null
                || response.result().alternatives().isEmpty()) {
            throw new MalformedUpstreamResponseException("YandexGPT response has no 'result.alternatives'");
        }
        Alternative first = response.result().alternatives().get(0);
        if (first == null || first.message() == null || first.message().text() == null) {
            throw new MalformedUpstreamResponseException("YandexGPT alternative has no message text");
        }
        return first.message().text();
    }

    record CompletionRequest(String modelUri, CompletionOptions completionOptions, List<WireMessage> messages) {
    }

    record CompletionOptions(boolean stream, double temperature, int maxTokens) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WireMessage(String role, String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(Result result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(List<Alternative> alternatives, String modelVersion) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Alternative(WireMessage message, String status) {
    }
}
