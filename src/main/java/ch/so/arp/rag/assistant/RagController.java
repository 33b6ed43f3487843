package ch.so.arp.rag.assistant;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint exposing the pipeline boundary to a chat front end.
 */
@RestController
@RequestMapping(path = "/api/rag", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class RagController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RagController.class);

    private final RagPipeline pipeline;

    public RagController(RagPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QueryResult query(@Valid @RequestBody QueryRequest request) {
        List<ChatMessage> history = request.history() == null ? List.of() : request.history();
        if (request.topK() == null) {
            return pipeline.queryWithHistory(request.question(), history);
        }
        return pipeline.queryWithHistory(request.question(), history, request.topK());
    }

    @PostMapping(path = "/index", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IndexResponse> index(@Valid @RequestBody IndexRequest request) {
        boolean success = pipeline.indexDocuments(request.documents(), request.sources());
        IndexResponse response = new IndexResponse(success, pipeline.stats().recordCount());
        if (!success) {
            LOGGER.warn("Indexing of {} documents failed", request.documents().size());
            return ResponseEntity.unprocessableEntity().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    public PipelineStats stats() {
        return pipeline.stats();
    }

    @PostMapping(path = "/image", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ImageAnalysisResult> image(@Valid @RequestBody ImageRequest request) {
        ImageAnalysisResult result = pipeline.processImage(request.imageUrl(), request.question());
        HttpStatus status = result.supported() ? HttpStatus.OK : HttpStatus.NOT_IMPLEMENTED;
        return ResponseEntity.status(status).body(result);
    }
}
