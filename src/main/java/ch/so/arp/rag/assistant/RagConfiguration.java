package ch.so.arp.rag.assistant;

import java.net.http.HttpClient;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Central configuration wiring the assistant components together. The Yandex
 * clients are used unless {@code rag.mock-upstream=true} switches to the
 * offline clients, so a deployment without credentials does not start.
 */
@Configuration
@EnableConfigurationProperties({ RagProperties.class, YandexCloudProperties.class })
public class RagConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public VectorIndex vectorIndex(RagProperties properties) {
        return new FlatFileVectorIndex(properties.index());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-upstream", havingValue = "true")
    public EmbeddingClient hashingEmbeddingClient(YandexCloudProperties yandex) {
        return new HashingEmbeddingClient(yandex.embedDimension(), yandex.maxEmbedChars());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-upstream", havingValue = "true")
    public CompletionClient mockCompletionClient() {
        return new MockCompletionClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-upstream", havingValue = "false", matchIfMissing = true)
    public RestClient yandexRestClient(RagProperties properties, YandexCloudProperties yandex) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.requestTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.requestTimeout());
        return RestClient.builder()
                .baseUrl(yandex.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-upstream", havingValue = "false", matchIfMissing = true)
    public EmbeddingClient yandexEmbeddingClient(RestClient yandexRestClient, YandexCloudProperties yandex) {
        return new YandexEmbeddingClient(yandexRestClient, yandex);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-upstream", havingValue = "false", matchIfMissing = true)
    public CompletionClient yandexGptClient(RestClient yandexRestClient, YandexCloudProperties yandex) {
        return new YandexGptClient(yandexRestClient, yandex);
    }
}
