package ch.so.arp.rag.assistant;

public record IndexResponse(boolean success, int recordCount) {
}
