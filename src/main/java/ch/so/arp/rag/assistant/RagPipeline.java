package ch.so.arp.rag.assistant;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coordinates the retrieval of context from the vector index and delegates the
 * answer generation to the completion service. Also owns the indexing workflow
 * that (re)builds the index from a batch of documents.
 * <p>
 * This class is the error boundary of the assistant: queries always produce a
 * {@link QueryResult} and indexing always produces a flag, nothing below it
 * escapes as an exception.
 * <p>
 * Queries hold the read lock while retrieving, indexing holds the write lock
 * while it replaces and persists the index. Embedding the documents happens
 * outside the lock.
 */
@Service
public class RagPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RagPipeline.class);

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final CompletionClient completionClient;
    private final DocumentRetriever retriever;
    private final RagProperties properties;
    private final PromptTemplate promptTemplate;
    private final ReadWriteLock indexLock = new ReentrantReadWriteLock();

    private volatile boolean loaded;

    public RagPipeline(EmbeddingClient embeddingClient, VectorIndex vectorIndex, CompletionClient completionClient,
            RagProperties properties) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.retriever = new DocumentRetriever(embeddingClient, vectorIndex, properties.includeSourceLabels());
        this.promptTemplate = new PromptTemplate(properties.promptTemplate());

        this.loaded = vectorIndex.load();
        if (loaded) {
            LOGGER.info("Pipeline initialized with a loaded index ({} documents)", vectorIndex.stats().recordCount());
        } else {
            LOGGER.warn("Pipeline initialized without an index. Index the documents before querying.");
        }
    }

    public QueryResult query(String query) {
        return query(query, properties.topK());
    }

    public QueryResult query(String query, int topK) {
        return queryWithHistory(query, List.of(), topK);
    }

    public QueryResult queryWithHistory(String query, List<ChatMessage> history) {
        return queryWithHistory(query, history, properties.topK());
    }

    /**
     * Answers a question using the knowledge base and the most recent part of
     * the conversation.
     *
     * @param query   the user question
     * @param history previous turns, oldest first, only the last
     *                {@code 2 * historyLimit} entries are forwarded
     * @param topK    number of documents to retrieve
     * @return the answer, or a result describing why there is none
     */
    public QueryResult queryWithHistory(String query, List<ChatMessage> history, int topK) {
        String model = completionClient.modelName();
        try {
            String context;
            List<String> sources;
            indexLock.readLock().lock();
            try {
                if (!loaded) {
                    LOGGER.error("Index not loaded, unable to answer '{}'", query);
                    return QueryResult.notLoaded(model, query);
                }
                context = retriever.retrieveContext(query, topK, properties.maxContextLength());
                sources = retriever.getRelevantSources(query, topK);
            } finally {
                indexLock.readLock().unlock();
            }

            List<ChatMessage> messages = buildMessages(promptTemplate.render(context, query), history);
            LOGGER.info("Generating answer with {} ({} messages)", model, messages.size());
            String answer = completionClient.complete(messages, properties.temperature(), properties.maxTokens());
            LOGGER.info("Answer generated, length: {} characters", answer.length());

            return QueryResult.answered(answer, context, sources, model, query);
        } catch (RagException ex) {
            LOGGER.error("Query '{}' failed ({}): {}", query, ex.kind(), ex.getMessage(), ex);
            return QueryResult.failed(ex.kind(), ex.getMessage(), model, query);
        } catch (RuntimeException ex) {
            LOGGER.error("Query '{}' failed: {}", query, ex.getMessage(), ex);
            return QueryResult.failed(ErrorKind.INTERNAL, String.valueOf(ex.getMessage()), model, query);
        }
    }

    /**
     * Rebuilds the index from the given documents and persists it. Either every
     * document ends up in the new index or the previous persisted index stays in
     * force.
     *
     * @param documents document texts
     * @param sources   source label per document
     * @return {@code true} if the new index was built and saved
     */
    public boolean indexDocuments(List<String> documents, List<String> sources) {
        if (documents == null || sources == null || documents.size() != sources.size()) {
            LOGGER.error("Indexing rejected: documents and sources must be non-null and of equal size");
            return false;
        }
        if (documents.isEmpty()) {
            LOGGER.warn("Indexing rejected: no documents given");
            return false;
        }
        LOGGER.info("Indexing {} documents", documents.size());

        List<float[]> vectors;
        try {
            vectors = embeddingClient.embedBatch(documents);
        } catch (RuntimeException ex) {
            LOGGER.error("Indexing failed while embedding documents: {}", ex.getMessage(), ex);
            return false;
        }

        indexLock.writeLock().lock();
        try {
            vectorIndex.create(embeddingClient.dimension());
            vectorIndex.add(documents, vectors, sources);
            vectorIndex.save();
            loaded = true;
            LOGGER.info("Indexing finished, {} documents stored", vectorIndex.stats().recordCount());
            return true;
        } catch (RuntimeException ex) {
            LOGGER.error("Indexing failed: {}", ex.getMessage(), ex);
            loaded = vectorIndex.load();
            LOGGER.warn("Restored the previously persisted index: {}", loaded ? "loaded" : "none available");
            return false;
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    /**
     * Image understanding is not available. The result says so explicitly
     * instead of producing placeholder text.
     */
    public ImageAnalysisResult processImage(String imageUrl, String question) {
        LOGGER.warn("Image analysis requested for {} but no vision service is configured", imageUrl);
        return ImageAnalysisResult.notSupported(imageUrl);
    }

    /**
     * Embeds a short sample text to find out whether the embedding service
     * answers with the current settings.
     *
     * @return {@code true} if a non-empty embedding came back
     */
    public boolean checkConnection() {
        try {
            float[] vector = embeddingClient.embed("test");
            LOGGER.info("Embedding service {} reachable, dimension {}", embeddingClient.modelName(), vector.length);
            return vector.length > 0;
        } catch (RagException ex) {
            LOGGER.warn("Embedding service {} not reachable ({}): {}", embeddingClient.modelName(), ex.kind(),
                    ex.getMessage());
            return false;
        }
    }

    public PipelineStats stats() {
        IndexStats indexStats = vectorIndex.stats();
        return new PipelineStats(indexStats.recordCount(), indexStats.dimension(), loaded,
                embeddingClient.modelName(), completionClient.modelName());
    }

    public boolean isLoaded() {
        return loaded;
    }

    private List<ChatMessage> buildMessages(String questionWithContext, List<ChatMessage> history) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(properties.systemPrompt()));
        List<ChatMessage> recent = recentHistory(history);
        if (!recent.isEmpty()) {
            messages.addAll(recent);
            LOGGER.info("Added {} messages from the history", recent.size());
        }
        messages.add(ChatMessage.user(questionWithContext));
        return messages;
    }

    /**
     * Conversation turns only: system entries supplied by the caller are dropped
     * before the window of the last {@code 2 * historyLimit} entries is taken.
     */
    private List<ChatMessage> recentHistory(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<ChatMessage> turns = history.stream()
                .filter(message -> message != null && message.role() != ChatMessage.Role.SYSTEM)
                .toList();
        if (turns.size() < history.size()) {
            LOGGER.warn("Ignored {} history entries that are not user or assistant turns",
                    history.size() - turns.size());
        }
        int maxEntries = Math.max(0, properties.historyLimit() * 2);
        if (turns.size() <= maxEntries) {
            return turns;
        }
        return turns.subList(turns.size() - maxEntries, turns.size());
    }
}
