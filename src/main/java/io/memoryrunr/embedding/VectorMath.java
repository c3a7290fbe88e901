package io.memoryrunr.embedding;

/**
 * Vector operations used by similarity search.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity {@code dot(a,b) / (|a| * |b|)}, in [-1, 1].
     * Returns 0 for vectors of different length, empty vectors or zero vectors.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** L2-normalizes a vector into a new array. Zero vectors are returned unchanged. */
    public static float[] normalize(float[] v) {
        if (v == null || v.length == 0) {
            return v;
        }
        double norm = 0.0;
        for (float x : v) {
            norm += (double) x * x;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0) {
            return v;
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }
}
