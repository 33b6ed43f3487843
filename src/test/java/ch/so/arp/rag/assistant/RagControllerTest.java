package ch.so.arp.rag.assistant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class RagControllerTest {

    private final RagPipeline pipeline = mock(RagPipeline.class);
    private final RagController controller = new RagController(pipeline);

    @Test
    void queriesWithConfiguredTopKWhenNoneGiven() {
        QueryResult expected = QueryResult.answered("Paris", "context", List.of("fr.txt"), "mock", "capital?");
        when(pipeline.queryWithHistory("capital?", List.of())).thenReturn(expected);

        QueryResult result = controller.query(new QueryRequest("capital?", null, null));

        assertThat(result).isSameAs(expected);
    }

    @Test
    void forwardsHistoryAndTopK() {
        List<ChatMessage> history = List.of(ChatMessage.user("Hi"), ChatMessage.assistant("Hello"));
        QueryResult expected = QueryResult.notLoaded("mock", "capital?");
        when(pipeline.queryWithHistory("capital?", history, 5)).thenReturn(expected);

        QueryResult result = controller.query(new QueryRequest("capital?", history, 5));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.INDEX_NOT_LOADED);
        verify(pipeline).queryWithHistory("capital?", history, 5);
    }

    @Test
    void reportsSuccessfulIndexing() {
        when(pipeline.indexDocuments(List.of("a", "b"), List.of("a.txt", "b.txt"))).thenReturn(true);
        when(pipeline.stats()).thenReturn(new PipelineStats(2, 256, true, "hashing-256", "mock"));

        ResponseEntity<IndexResponse> response = controller
                .index(new IndexRequest(List.of("a", "b"), List.of("a.txt", "b.txt")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(new IndexResponse(true, 2));
    }

    @Test
    void reportsFailedIndexingAsUnprocessable() {
        when(pipeline.indexDocuments(List.of("a"), List.of())).thenReturn(false);
        when(pipeline.stats()).thenReturn(new PipelineStats(0, 0, false, "hashing-256", "mock"));

        ResponseEntity<IndexResponse> response = controller.index(new IndexRequest(List.of("a"), List.of()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).isEqualTo(new IndexResponse(false, 0));
    }

    @Test
    void reportsMissingImageSupport() {
        when(pipeline.processImage("https://example.test/a.png", null))
                .thenReturn(ImageAnalysisResult.notSupported("https://example.test/a.png"));

        ResponseEntity<ImageAnalysisResult> response = controller
                .image(new ImageRequest("https://example.test/a.png", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_IMPLEMENTED);
        assertThat(response.getBody().supported()).isFalse();
    }
}
