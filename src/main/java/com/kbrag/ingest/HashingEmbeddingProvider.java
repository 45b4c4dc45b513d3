package com.kbrag.ingest;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Offline bag-of-words embedding: tokens hashed into {@code dimension} buckets and
 * L2-normalised, so cosine similarity tracks shared vocabulary.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("\\W+");

    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        return texts.stream().map(this::vectorFor).toList();
    }

    private float[] vectorFor(String text) {
        int[] counts = new int[dimension];
        long squaredNorm = 0;
        if (text != null) {
            for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
                if (token.isEmpty()) {
                    continue;
                }
                int bucket = Math.floorMod(token.hashCode(), dimension);
                // (c + 1)^2 - c^2 keeps the squared norm current without a second pass
                squaredNorm += 2L * counts[bucket] + 1;
                counts[bucket]++;
            }
        }
        float[] vector = new float[dimension];
        if (squaredNorm == 0) {
            return vector;
        }
        double norm = Math.sqrt(squaredNorm);
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (counts[i] / norm);
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }
}
