package ch.so.arp.rag.assistant;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline {@link EmbeddingClient} for development and tests. Every word of the
 * text is hashed into one of {@code dimensions} buckets and the bucket counts
 * are normalized to unit length, so texts sharing words end up close to each
 * other and the retrieval flow can be tried without the Yandex API.
 * <p>
 * Inputs are cut to the same character limit the real client applies.
 */
class HashingEmbeddingClient implements EmbeddingClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashingEmbeddingClient.class);

    private final int dimensions;
    private final int maxChars;

    HashingEmbeddingClient(int dimensions, int maxChars) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        this.dimensions = dimensions;
        this.maxChars = maxChars;
        LOGGER.info("Using offline hashing embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        String input = text == null ? "" : text;
        if (input.length() > maxChars) {
            LOGGER.warn("Embedding input truncated from {} to {} characters", input.length(), maxChars);
            input = input.substring(0, maxChars);
        }

        float[] vector = new float[dimensions];
        for (String word : input.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!word.isEmpty()) {
                vector[bucket(word)] += 1.0f;
            }
        }
        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimensions;
    }

    @Override
    public String modelName() {
        return "hashing-" + dimensions;
    }

    private int bucket(String word) {
        CRC32 crc = new CRC32();
        crc.update(word.getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % dimensions);
    }

    private static void normalize(float[] vector) {
        double norm = 0.0d;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm == 0.0d) {
            return;
        }
        double length = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / length);
        }
    }
}
