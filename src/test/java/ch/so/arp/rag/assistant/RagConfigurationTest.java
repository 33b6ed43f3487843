package ch.so.arp.rag.assistant;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class RagConfigurationTest {

    @TempDir
    Path directory;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withUserConfiguration(RagConfiguration.class, RagPipeline.class)
                .withPropertyValues(
                        "rag.index.vector-file=" + directory.resolve("index.vec"),
                        "rag.index.metadata-file=" + directory.resolve("metadata.json"));
    }

    @Test
    void failsWithoutCredentialsByDefault() {
        contextRunner().run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).rootCause()
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("rag.yandex.api-key");
        });
    }

    @Test
    void usesYandexClientsByDefault() {
        contextRunner()
                .withPropertyValues(
                        "rag.yandex.api-key=test-key",
                        "rag.yandex.folder-id=folder-1",
                        "rag.yandex.chat-model=yandexgpt")
                .run(context -> {
                    assertThat(context).getBean(EmbeddingClient.class).isInstanceOf(YandexEmbeddingClient.class);
                    assertThat(context).getBean(CompletionClient.class).isInstanceOf(YandexGptClient.class);
                    assertThat(context).getBean(VectorIndex.class).isInstanceOf(FlatFileVectorIndex.class);
                    YandexCloudProperties yandex = context.getBean(YandexCloudProperties.class);
                    assertThat(yandex.chatModelUri()).isEqualTo("gpt://folder-1/yandexgpt");
                    assertThat(yandex.embedModelUri()).isEqualTo("emb://folder-1/text-search-doc");
                });
    }

    @Test
    void failsWithoutFolderIdWhenMocksDisabled() {
        contextRunner()
                .withPropertyValues("rag.mock-upstream=false", "rag.yandex.api-key=test-key")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("rag.yandex.folder-id");
                });
    }

    @Test
    void usesOfflineClientsWhenMocksEnabled() {
        contextRunner()
                .withPropertyValues("rag.mock-upstream=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(EmbeddingClient.class);
                    assertThat(context).getBean(EmbeddingClient.class).isInstanceOf(HashingEmbeddingClient.class);
                    assertThat(context).hasSingleBean(CompletionClient.class);
                    assertThat(context).getBean(CompletionClient.class).isInstanceOf(MockCompletionClient.class);
                    assertThat(context).doesNotHaveBean(YandexEmbeddingClient.class);

                    RagPipeline pipeline = context.getBean(RagPipeline.class);
                    assertThat(pipeline.isLoaded()).isFalse();
                    assertThat(pipeline.stats().embedModel()).isEqualTo("hashing-256");
                });
    }

    @Test
    void bindsPipelineSettings() {
        contextRunner()
                .withPropertyValues("rag.mock-upstream=true", "rag.top-k=5", "rag.history-limit=4",
                        "rag.request-timeout=10s", "rag.index.metric=COSINE")
                .run(context -> {
                    RagProperties properties = context.getBean(RagProperties.class);
                    assertThat(properties.topK()).isEqualTo(5);
                    assertThat(properties.historyLimit()).isEqualTo(4);
                    assertThat(properties.maxContextLength()).isEqualTo(3000);
                    assertThat(properties.requestTimeout()).hasSeconds(10);
                    assertThat(properties.mockUpstream()).isTrue();
                    assertThat(properties.index().metric()).isEqualTo(SimilarityMetric.COSINE);
                    assertThat(properties.systemPrompt()).isEqualTo(RagProperties.DEFAULT_SYSTEM_PROMPT);
                });
    }
}
