package br.edu.ifba.graphrag.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Vector helpers shared by the disambiguator, the beam tracer and the vector route.
 */
public final class EmbeddingUtil {

    private EmbeddingUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Computes cosine similarity between two embeddings.
     * Returns a value between -1 (opposite) and 1 (identical); 0 when either vector is zero.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosineSimilarity(@NotNull float[] a, @NotNull float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embeddings must have same dimension: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Cosine similarity that treats missing or mismatched vectors as unrelated (0).
     */
    public static double similarityOrZero(@Nullable float[] a, @Nullable float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        return cosineSimilarity(a, b);
    }

    @NotNull
    public static float[] toFloatArray(@NotNull List<? extends Number> values) {
        float[] result = new float[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i).floatValue();
        }
        return result;
    }
}
