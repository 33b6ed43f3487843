package ch.so.arp.rag.assistant;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request payload of the query endpoint. {@code history} and {@code topK} are optional,
 * history entries must be user or assistant turns.
 */
public record QueryRequest(@NotBlank String question, List<ChatMessage> history, @Positive Integer topK) {

    @JsonIgnore
    @AssertTrue(message = "history may only contain user and assistant messages")
    public boolean isHistoryOfConversationTurns() {
        return history == null || history.stream()
                .allMatch(message -> message != null && message.role() != ChatMessage.Role.SYSTEM);
    }
}
