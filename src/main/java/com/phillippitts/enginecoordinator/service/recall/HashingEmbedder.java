package com.phillippitts.enginecoordinator.service.recall;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hashed bag-of-words embedding: each token increments one of {@link #DIMENSIONS} buckets and
 * the vector is L2-normalized, so the dot product of two embeddings is their cosine similarity.
 */
public final class HashingEmbedder {

    public static final int DIMENSIONS = 256;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "in", "is", "it",
            "of", "on", "or", "that", "the", "this", "to", "was", "with");

    public float[] embed(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String token : tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1.0f;
        }
        return normalize(vector);
    }

    /**
     * Lower-cased alphanumeric tokens longer than one character, stop words removed.
     */
    public static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector is zero.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return dot / Math.sqrt(na * nb);
    }

    static float[] normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            return vector;
        }
        float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= inv;
        }
        return vector;
    }
}
