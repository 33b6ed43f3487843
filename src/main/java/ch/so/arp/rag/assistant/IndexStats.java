package ch.so.arp.rag.assistant;

/**
 * Snapshot of the vector index state.
 *
 * @param recordCount number of stored documents
 * @param dimension   configured vector dimension, {@code 0} when no index exists
 * @param loaded      whether the in-memory index matches a persisted one
 */
public record IndexStats(int recordCount, int dimension, boolean loaded) {
}
