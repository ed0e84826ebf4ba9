package io.repo.vectors.embeddings;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimpleEmbeddingModelTest {

    private final SimpleEmbeddingModel model = new SimpleEmbeddingModel(256);

    @Test
    void testDeterministic() {
        assertArrayEquals(model.embed("def load_config(path)"), model.embed("def load_config(path)"));
    }

    @Test
    void testNormalized() {
        float[] vector = model.embed("class UserRepository { User findById(long id) }");

        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        assertEquals(256, vector.length);
        assertEquals(1.0, Math.sqrt(norm), 1e-5);
    }

    @Test
    void testSharedVocabularyScoresHigher() {
        float[] query = model.embed("load configuration file");
        float[] related = model.embed("def load_configuration_file(path):\n    return yaml.load(open(path))");
        float[] unrelated = model.embed("fn render_triangle(vertices: &[Vertex]) -> Mesh");

        assertTrue(dot(query, related) > dot(query, unrelated));
    }

    @Test
    void testIdentifierStylesMatch() {
        float[] camel = model.embed("parseConfigFile");
        float[] snake = model.embed("parse_config_file");

        assertEquals(1.0, dot(camel, snake), 1e-5);
    }

    @Test
    void testTextWithoutTokensIsZero() {
        float[] vector = model.embed("{ } ( ) ;");

        for (float v : vector) {
            assertEquals(0f, v);
        }
    }

    @Test
    void testBatchPreservesOrder() {
        List<float[]> batch = model.embedBatch(List.of("alpha beta", "gamma delta"));

        assertEquals(2, batch.size());
        assertArrayEquals(model.embed("alpha beta"), batch.get(0));
        assertArrayEquals(model.embed("gamma delta"), batch.get(1));
    }

    @Test
    void testModelIdIncludesDimensions() {
        assertEquals("simple-hash:256", model.getModelId());
        assertEquals(EmbeddingConfig.DEFAULT_SIMPLE_DIMENSIONS,
            EmbeddingModel.load(EmbeddingConfig.defaults()).getDimensions());
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
