package ch.so.arp.rag.assistant;

import java.util.ArrayList;
import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for documents and questions.
 * Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 */
public interface EmbeddingClient {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws UpstreamCallException if the embedding service cannot be reached or answers unexpectedly
     */
    float[] embed(String text);

    /**
     * Embed several texts one after another. The first failure aborts the batch.
     */
    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Dimension of the vectors produced, as observed on the latest response.
     */
    int dimension();

    String modelName();
}
