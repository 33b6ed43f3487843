package ch.so.arp.rag.assistant;

import java.util.List;

/**
 * Deterministic {@link CompletionClient} used in tests and local development
 * where the completion API should not be contacted. It echoes the last message
 * so that the assembled prompt can be inspected.
 */
class MockCompletionClient implements CompletionClient {

    @Override
    public String complete(List<ChatMessage> messages, double temperature, int maxTokens) {
        String lastMessage = messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
        return "[mocked answer] Provide Yandex credentials to reach the real completion service.\n"
                + "Messages sent: " + messages.size() + "\n"
                + lastMessage;
    }

    @Override
    public String modelName() {
        return "mock";
    }
}
