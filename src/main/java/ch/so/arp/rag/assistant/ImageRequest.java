package ch.so.arp.rag.assistant;

import jakarta.validation.constraints.NotBlank;

public record ImageRequest(@NotBlank String imageUrl, String question) {
}
