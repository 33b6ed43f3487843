package ch.so.arp.rag.assistant;

/**
 * Pipeline level statistics, exposed to the front end.
 */
public record PipelineStats(int recordCount, int dimension, boolean loaded, String embedModel, String chatModel) {
}
