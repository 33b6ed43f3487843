package ch.so.arp.rag.assistant;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real completion API or return predictable responses for testing.
 */
public interface CompletionClient {

    /**
     * Generate an answer for the given conversation.
     *
     * @param messages    system instruction, previous turns and the current question
     * @param temperature sampling temperature
     * @param maxTokens   upper bound of the generated answer
     * @return the generated text
     * @throws UpstreamCallException if the service cannot be reached or answers unexpectedly
     */
    String complete(List<ChatMessage> messages, double temperature, int maxTokens);

    String modelName();
}
