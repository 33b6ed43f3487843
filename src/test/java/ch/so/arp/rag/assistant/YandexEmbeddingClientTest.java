package ch.so.arp.rag.assistant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class YandexEmbeddingClientTest {

    private static final String BASE_URL = "https://llm.example.test/foundationModels/v1";

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Test
    void sendsModelUriTextAndCredentials() {
        server.expect(requestTo(BASE_URL + "/textEmbedding"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Api-Key secret"))
                .andExpect(header("x-folder-id", "folder-1"))
                .andExpect(jsonPath("$.modelUri").value("emb://folder-1/text-search-doc"))
                .andExpect(jsonPath("$.text").value("What is RAG?"))
                .andRespond(withSuccess("""
                        {"embedding": [0.5, -0.25, 1.0, 0.0], "numTokens": "4", "modelVersion": "v1"}
                        """, MediaType.APPLICATION_JSON));
        YandexEmbeddingClient client = new YandexEmbeddingClient(restClient, properties(4, 10000));

        float[] embedding = client.embed("What is RAG?");

        assertThat(embedding).containsExactly(0.5f, -0.25f, 1.0f, 0.0f);
        server.verify();
    }

    @Test
    void truncatesLongInputs() {
        server.expect(requestTo(BASE_URL + "/textEmbedding"))
                .andExpect(jsonPath("$.text").value("abcde"))
                .andRespond(withSuccess("{\"embedding\": [1.0, 2.0]}", MediaType.APPLICATION_JSON));
        YandexEmbeddingClient client = new YandexEmbeddingClient(restClient, properties(2, 5));

        client.embed("abcdefghij");

        server.verify();
    }

    @Test
    void adoptsTheDimensionOfTheFirstResponse() {
        server.expect(requestTo(BASE_URL + "/textEmbedding"))
                .andRespond(withSuccess("{\"embedding\": [1.0, 2.0, 3.0]}", MediaType.APPLICATION_JSON));
        YandexEmbeddingClient client = new YandexEmbeddingClient(restClient, properties(256, 10000));
        assertThat(client.dimension()).isEqualTo(256);

        client.embed("text");

        assertThat(client.dimension()).isEqualTo(3);
        assertThat(client.modelName()).isEqualTo("text-search-doc");
    }

    @Test
    void rejectsResponsesWithoutEmbedding() {
        server.expect(requestTo(BASE_URL + "/textEmbedding"))
                .andRespond(withSuccess("{\"numTokens\": \"2\"}", MediaType.APPLICATION_JSON));
        YandexEmbeddingClient client = new YandexEmbeddingClient(restClient, properties(256, 10000));

        assertThatThrownBy(() -> client.embed("text"))
                .isInstanceOf(MalformedUpstreamResponseException.class)
                .extracting(ex -> ((RagException) ex).kind())
                .isEqualTo(ErrorKind.MALFORMED_UPSTREAM_RESPONSE);
    }

    @Test
    void rejectsUnreadableResponses() {
        server.expect(requestTo(BASE_URL + "/textEmbedding"))
                .andRespond(withSuccess("{\"embedding\": \"not a vector\"}", MediaType.APPLICATION_JSON));
        YandexEmbeddingClient client = new YandexEmbeddingClient(restClient, properties(256, 10000));

        assertThatThrownBy(() -> client.embed("text")).isInstanceOf(MalformedUpstreamResponseException.class);
    }

    @Test
    void wrapsHttpErrors() {
        server.expect(requestTo(BASE_URL + "/textEmbedding"))
                .andRespond(withServerError().body("quota exceeded"));
        YandexEmbeddingClient client = new YandexEmbeddingClient(restClient, properties(256, 10000));

        assertThatThrownBy(() -> client.embed("text"))
                .isExactlyInstanceOf(UpstreamCallException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void requiresCredentials() {
        YandexCloudProperties withoutKey = new YandexCloudProperties("", "folder-1", BASE_URL, "text-search-doc",
                "yandexgpt-lite", 256, 10000);

        assertThatThrownBy(() -> new YandexEmbeddingClient(restClient, withoutKey))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("rag.yandex.api-key");
    }

    private static YandexCloudProperties properties(int dimension, int maxEmbedChars) {
        return new YandexCloudProperties("secret", "folder-1", BASE_URL, "text-search-doc", "yandexgpt-lite",
                dimension, maxEmbedChars);
    }
}
