package io.repo.vectors.embeddings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline embedding model using the hashing trick over code tokens.
 *
 * <p>Each identifier word (see {@link CodePreprocessor#tokens(String)}) and each
 * pair of adjacent words is hashed into one of {@code dimensions} buckets with
 * a hash-derived sign. Texts sharing vocabulary therefore score higher than
 * unrelated texts, which is enough for keyword-level retrieval and for tests.</p>
 *
 * <p>Output is deterministic and L2-normalized.</p>
 */
public class SimpleEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(SimpleEmbeddingModel.class);

    public static final String MODEL_ID = "simple-hash";

    private static final float BIGRAM_WEIGHT = 0.5f;

    private final int dimensions;
    private final CodePreprocessor preprocessor;

    public SimpleEmbeddingModel(EmbeddingConfig config) {
        this(config.dimensions() > 0 ? config.dimensions() : EmbeddingConfig.DEFAULT_SIMPLE_DIMENSIONS);
    }

    public SimpleEmbeddingModel(int dimensions) {
        if (dimensions <= 0) throw new IllegalArgumentException("dimensions must be positive");
        this.dimensions = dimensions;
        this.preprocessor = CodePreprocessor.forTokens();

        log.info("Initialized SimpleEmbeddingModel ({}d)", dimensions);
    }

    @Override
    public float[] embed(String text) {
        float[] embedding = new float[dimensions];
        List<String> tokens = preprocessor.tokens(text);

        String previous = null;
        for (String token : tokens) {
            add(embedding, token, 1f);
            if (previous != null) {
                add(embedding, previous + " " + token, BIGRAM_WEIGHT);
            }
            previous = token;
        }

        normalize(embedding);
        return embedding;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embed(text));
        }
        return embeddings;
    }

    @Override
    public String getModelId() {
        return MODEL_ID + ":" + dimensions;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        // Nothing to close
    }

    private void add(float[] embedding, String feature, float weight) {
        int hash = fnv1a(feature);
        int bucket = Math.floorMod(hash, dimensions);
        float sign = (hash >>> 31) == 0 ? 1f : -1f;
        embedding[bucket] += sign * weight;
    }

    static int fnv1a(String text) {
        int hash = 0x811c9dc5;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xFF;
            hash *= 0x01000193;
        }
        return hash;
    }

    private static void normalize(float[] vector) {
        float norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);

        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
    }
}
