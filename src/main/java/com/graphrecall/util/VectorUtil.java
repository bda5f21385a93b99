package com.graphrecall.util;

/**
 * Conversions between float arrays and the pgvector text format, plus cosine math.
 */
public final class VectorUtil {

    private VectorUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Format float array as pgvector string format, e.g. {@code [0.1,0.2]}.
     */
    public static String format(float[] vector) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(vector[i]);
        }
        sb.append("]");
        return sb.toString();
    }

    /**
     * Parse the pgvector text form back into a float array.
     *
     * @param text vector literal as returned by {@code column::text}, may be null
     * @return parsed vector, or null when the column was null
     */
    public static float[] parse(String text) {
        if (text == null) {
            return null;
        }
        String body = text.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    /**
     * Cosine similarity in [-1, 1]. Zero vectors have similarity 0.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Embeddings must have same dimensions: " + a.length + " vs " + b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Cosine distance as pgvector's {@code <=>} operator defines it: {@code 1 - similarity}.
     */
    public static double cosineDistance(float[] a, float[] b) {
        return 1.0 - cosineSimilarity(a, b);
    }
}
