package ch.so.arp.appliedai.retrieval;

import ch.so.arp.appliedai.error.AssistantException;

/**
 * Numeric helpers for embedding vectors.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two vectors of equal length.
     *
     * @return a value in {@code [-1, 1]}, or {@code 0} when either vector has
     *         zero magnitude
     * @throws AssistantException with {@code INVALID_INPUT} when the lengths
     *                            differ
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw AssistantException.invalidInput(
                    "Vectors must have the same dimension (" + a.length + " != " + b.length + ")");
        }
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0d || normB == 0.0d) {
            return 0.0d;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push the quotient a hair outside the range
        return Math.max(-1.0d, Math.min(1.0d, similarity));
    }
}
