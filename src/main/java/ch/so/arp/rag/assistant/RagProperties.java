package ch.so.arp.rag.assistant;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

/**
 * Immutable settings of the retrieval pipeline. Bound once at startup and
 * handed to the components through their constructors.
 *
 * @param topK                number of documents retrieved per query
 * @param maxContextLength    character budget of the context block
 * @param historyLimit        question/answer pairs kept from the conversation
 * @param requestTimeout      connect and read timeout of every outbound call
 * @param temperature         generation temperature
 * @param maxTokens           maximum size of the generated answer
 * @param includeSourceLabels whether context passages are prefixed with their source
 * @param mockUpstream        use offline embedding and completion clients
 * @param systemPrompt        instruction sent as the first message
 * @param promptTemplate      template with {@code {context}} and {@code {query}} placeholders
 * @param index               location and metric of the persisted index
 */
@ConfigurationProperties(prefix = "rag")
public record RagProperties(
        @DefaultValue("3") int topK,
        @DefaultValue("3000") int maxContextLength,
        @DefaultValue("10") int historyLimit,
        @DefaultValue("30s") Duration requestTimeout,
        @DefaultValue("0.7") double temperature,
        @DefaultValue("1000") int maxTokens,
        @DefaultValue("true") boolean includeSourceLabels,
        @DefaultValue("false") boolean mockUpstream,
        String systemPrompt,
        String promptTemplate,
        @DefaultValue Index index) {

    public static final String DEFAULT_SYSTEM_PROMPT = """
            You are an intelligent assistant with access to a knowledge base.
            Your task is to answer the user's questions based on the provided context.

            Rules:
            1. Use the information from the knowledge base context to form the answer
            2. Take the previous messages into account to understand the conversation
            3. If the user refers to "this", "that" or "the previous question", look at the history
            4. If the context does not contain the answer, say so honestly
            5. Answer clearly and in a structured way
            6. Use lists and bullet points where they improve readability
            7. Be polite and professional
            """;

    public static final String DEFAULT_PROMPT_TEMPLATE = """
            Context from the knowledge base:
            {context}

            User question: {query}

            Answer:""";

    public RagProperties {
        if (!StringUtils.hasText(systemPrompt)) {
            systemPrompt = DEFAULT_SYSTEM_PROMPT;
        }
        if (!StringUtils.hasText(promptTemplate)) {
            promptTemplate = DEFAULT_PROMPT_TEMPLATE;
        }
        if (index == null) {
            index = Index.defaults();
        }
    }

    public static RagProperties defaults() {
        return new RagProperties(3, 3000, 10, Duration.ofSeconds(30), 0.7d, 1000, true, false, null, null,
                Index.defaults());
    }

    /**
     * Location of the two index artifacts.
     *
     * @param vectorFile   binary vector store
     * @param metadataFile JSON sidecar with text and source per vector
     * @param metric       distance used for nearest-neighbour search
     */
    public record Index(
            @DefaultValue("data/index.vec") Path vectorFile,
            @DefaultValue("data/metadata.json") Path metadataFile,
            @DefaultValue("L2") SimilarityMetric metric) {

        public static Index defaults() {
            return new Index(Path.of("data/index.vec"), Path.of("data/metadata.json"), SimilarityMetric.L2);
        }
    }
}
