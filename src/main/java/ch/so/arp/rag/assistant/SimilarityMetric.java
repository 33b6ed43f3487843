package ch.so.arp.rag.assistant;

/**
 * Distance functions available to the flat index. Lower values mean more
 * similar vectors.
 */
public enum SimilarityMetric {

    /**
     * Squared Euclidean distance.
     */
    L2 {
        @Override
        public double distance(float[] a, float[] b) {
            double sum = 0.0d;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                sum += diff * diff;
            }
            return sum;
        }
    },

    /**
     * One minus the cosine similarity. Zero vectors are treated as orthogonal to everything.
     */
    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            double dot = 0.0d;
            double normA = 0.0d;
            double normB = 0.0d;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }
            if (normA == 0.0d || normB == 0.0d) {
                return 1.0d;
            }
            return 1.0d - dot / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    };

    public abstract double distance(float[] a, float[] b);
}
