package io.repo.vectors;

import io.repo.vectors.pipeline.EmbeddingProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic test provider: lower-case words hashed into a fixed number of buckets.
 */
public class BagOfWordsProvider implements EmbeddingProvider {

    public static final int DIMENSIONS = 64;

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        calls.incrementAndGet();
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    public static float[] embed(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!word.isEmpty()) {
                vector[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1f;
            }
        }
        return vector;
    }

    public int calls() {
        return calls.get();
    }
}
