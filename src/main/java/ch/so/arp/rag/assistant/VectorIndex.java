package ch.so.arp.rag.assistant;

import java.util.List;

/**
 * Durable, queryable storage of embedding vectors together with the text and
 * source label of every vector.
 * <p>
 * Records are kept in insertion order. The position of a record never changes,
 * which keeps the vector store and the metadata sidecar aligned.
 */
public interface VectorIndex {

    /**
     * Replace the in-memory index with an empty one for vectors of the given
     * dimension. Persisted artifacts stay untouched until {@link #save()}.
     *
     * @param dimension vector length, must be positive
     */
    void create(int dimension);

    /**
     * Append records at the end of the index.
     *
     * @param texts   document texts
     * @param vectors embedding vectors, one per text
     * @param sources source labels, one per text
     * @throws LengthMismatchException    if the three lists differ in size
     * @throws DimensionMismatchException if a vector does not match the index dimension
     * @throws IllegalStateException      if {@link #create(int)} or {@link #load()} was not called before
     */
    void add(List<String> texts, List<float[]> vectors, List<String> sources);

    /**
     * Find the nearest records, best first. Ties keep insertion order.
     *
     * @param queryVector query embedding
     * @param k           maximum number of hits
     * @return at most {@code k} hits, empty when the index holds no records
     */
    List<SearchHit> search(float[] queryVector, int k);

    /**
     * Persist the vector store and the metadata sidecar.
     *
     * @throws IndexPersistenceException if writing fails
     */
    void save();

    /**
     * Restore a previously saved index.
     *
     * @return {@code true} when both artifacts exist and were reconstructed
     */
    boolean load();

    IndexStats stats();
}
