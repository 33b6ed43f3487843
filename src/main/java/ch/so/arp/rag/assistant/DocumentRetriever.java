package ch.so.arp.rag.assistant;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a free-text query into grounded context by embedding it and searching
 * the vector index.
 * <p>
 * Context assembly and source listing are independent operations, each runs
 * its own embedding and search.
 */
public class DocumentRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentRetriever.class);

    static final String PASSAGE_SEPARATOR = "\n\n";

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final boolean includeSourceLabels;

    public DocumentRetriever(EmbeddingClient embeddingClient, VectorIndex vectorIndex, boolean includeSourceLabels) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.includeSourceLabels = includeSourceLabels;
    }

    /**
     * Concatenates the texts of the {@code topK} nearest documents in relevance
     * order and cuts the result at {@code maxLength} characters, possibly in the
     * middle of a document.
     *
     * @return the context block, empty when the index holds no records
     */
    public String retrieveContext(String query, int topK, int maxLength) {
        List<SearchHit> hits = search(query, topK);
        if (hits.isEmpty() || maxLength <= 0) {
            return "";
        }

        StringBuilder context = new StringBuilder();
        for (SearchHit hit : hits) {
            if (context.length() > 0) {
                context.append(PASSAGE_SEPARATOR);
            }
            context.append(hit.formatForPrompt(includeSourceLabels));
            if (context.length() >= maxLength) {
                break;
            }
        }
        if (context.length() > maxLength) {
            LOGGER.debug("Context truncated from {} to {} characters", context.length(), maxLength);
            context.setLength(maxLength);
        }
        return context.toString();
    }

    /**
     * Source labels of the {@code topK} nearest documents, without duplicates,
     * in order of first appearance.
     */
    public List<String> getRelevantSources(String query, int topK) {
        Set<String> sources = new LinkedHashSet<>();
        for (SearchHit hit : search(query, topK)) {
            sources.add(hit.source());
        }
        return List.copyOf(sources);
    }

    private List<SearchHit> search(String query, int topK) {
        if (vectorIndex.stats().recordCount() == 0) {
            return List.of();
        }
        float[] queryVector = embeddingClient.embed(query);
        List<SearchHit> hits = vectorIndex.search(queryVector, topK);
        LOGGER.debug("Found {} documents for query '{}'", hits.size(), query);
        return hits;
    }
}
