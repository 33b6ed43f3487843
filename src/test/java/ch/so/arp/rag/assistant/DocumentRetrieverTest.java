package ch.so.arp.rag.assistant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentRetrieverTest {

    @TempDir
    Path directory;

    private final KeywordEmbeddingClient embeddingClient = new KeywordEmbeddingClient("apple", "banana", "cherry");

    private FlatFileVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new FlatFileVectorIndex(directory.resolve("i.vec"), directory.resolve("m.json"), SimilarityMetric.L2);
        index.create(embeddingClient.dimension());
        List<String> texts = List.of("apple apple pie", "banana bread", "apple crumble", "cherry tart");
        index.add(texts, embeddingClient.embedBatch(texts), List.of("fruit.txt", "bakery.txt", "fruit.txt", "tart.txt"));
    }

    @Test
    void concatenatesTextsInRelevanceOrderWithSources() {
        DocumentRetriever retriever = new DocumentRetriever(embeddingClient, index, true);

        String context = retriever.retrieveContext("apple", 2, 1000);

        assertThat(context).isEqualTo("Source: fruit.txt\napple crumble\n\nSource: fruit.txt\napple apple pie");
    }

    @Test
    void omitsSourceLabelsWhenDisabled() {
        DocumentRetriever retriever = new DocumentRetriever(embeddingClient, index, false);

        assertThat(retriever.retrieveContext("banana", 1, 1000)).isEqualTo("banana bread");
    }

    @Test
    void neverExceedsTheCharacterBudget() {
        DocumentRetriever retriever = new DocumentRetriever(embeddingClient, index, true);

        for (int maxLength : new int[] { 0, 1, 5, 20, 37, 200 }) {
            assertThat(retriever.retrieveContext("apple cherry", 4, maxLength)).hasSizeLessThanOrEqualTo(maxLength);
        }
        assertThat(retriever.retrieveContext("banana", 1, 10)).isEqualTo("Source: ba");
    }

    @Test
    void sourcesAreDistinctAndKeepFirstSeenOrder() {
        DocumentRetriever retriever = new DocumentRetriever(embeddingClient, index, true);

        assertThat(retriever.getRelevantSources("apple", 4))
                .containsExactly("fruit.txt", "bakery.txt", "tart.txt");
    }

    @Test
    void emptyIndexYieldsEmptyContextWithoutEmbedding() {
        index.create(embeddingClient.dimension());
        DocumentRetriever retriever = new DocumentRetriever(embeddingClient, index, true);
        embeddingClient.embeddedTexts().clear();

        assertThat(retriever.retrieveContext("apple", 3, 100)).isEmpty();
        assertThat(retriever.getRelevantSources("apple", 3)).isEmpty();
        assertThat(embeddingClient.embeddedTexts()).isEmpty();
    }

    @Test
    void embeddingFailuresPropagate() {
        EmbeddingClient failing = new KeywordEmbeddingClient("apple") {
            @Override
            public float[] embed(String text) {
                throw new UpstreamCallException("embeddings down", null);
            }
        };
        DocumentRetriever retriever = new DocumentRetriever(failing, index, true);

        assertThatThrownBy(() -> retriever.retrieveContext("apple", 1, 100))
                .isInstanceOf(UpstreamCallException.class);
    }
}
