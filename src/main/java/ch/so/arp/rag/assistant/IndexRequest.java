package ch.so.arp.rag.assistant;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Documents to index, {@code sources.get(i)} labels {@code documents.get(i)}.
 */
public record IndexRequest(@NotEmpty List<String> documents, @NotNull List<String> sources) {
}
