package io.repo.vectors;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorIndexTest {

    @Test
    void testEmptyIndex() {
        VectorIndex index = VectorIndex.of(List.of());

        assertTrue(index.isEmpty());
        assertEquals(0, index.dimensions());
        assertEquals(List.of(), index.search(new float[]{1f, 0f}, 5));
    }

    @Test
    void testSingleRowSelfMatch() {
        float[] vector = {0.3f, -1.2f, 4.0f, 0.5f};
        VectorIndex index = VectorIndex.of(List.of(vector));

        List<IndexHit> hits = index.search(vector, 1);

        assertEquals(1, index.size());
        assertEquals(1, hits.size());
        assertEquals(0, hits.get(0).row());
        assertEquals(1.0f, hits.get(0).score(), 1e-5f);
    }

    @Test
    void testRowsAlignWithInput() {
        Random random = new Random(42);
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            float[] vector = new float[16];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = (float) random.nextGaussian();
            }
            vectors.add(vector);
        }
        VectorIndex index = VectorIndex.of(vectors);

        assertEquals(50, index.size());
        assertEquals(16, index.dimensions());
        for (int row : new int[]{0, 17, 49}) {
            assertEquals(row, index.search(vectors.get(row), 1).get(0).row());
        }
    }

    @Test
    void testScoresDescendingAndTopKClamped() {
        VectorIndex index = VectorIndex.of(List.of(
            new float[]{1f, 0f},
            new float[]{0f, 1f},
            new float[]{1f, 1f}
        ));

        List<IndexHit> hits = index.search(new float[]{1f, 0.1f}, 10);

        assertEquals(3, hits.size());
        assertEquals(List.of(0, 2, 1), hits.stream().map(IndexHit::row).toList());
        assertTrue(hits.get(0).score() >= hits.get(1).score());
        assertTrue(hits.get(1).score() >= hits.get(2).score());
    }

    @Test
    void testTiesBrokenByLowerRow() {
        VectorIndex index = VectorIndex.of(List.of(
            new float[]{0f, 1f},
            new float[]{2f, 0f},
            new float[]{1f, 0f},
            new float[]{5f, 0f}
        ));

        List<IndexHit> hits = index.search(new float[]{1f, 0f}, 2);

        assertEquals(List.of(1, 2), hits.stream().map(IndexHit::row).toList());
    }

    @Test
    void testNegativeScoresAreKept() {
        VectorIndex index = VectorIndex.of(List.of(new float[]{-1f, 0f}));

        assertEquals(-1.0f, index.search(new float[]{1f, 0f}, 1).get(0).score(), 1e-6f);
    }

    @Test
    void testDimensionMismatchOnBuild() {
        VectorIndex index = VectorIndex.create();

        IndexIntegrityException e = assertThrows(IndexIntegrityException.class,
            () -> index.build(List.of(new float[]{1f, 0f}, new float[]{1f, 0f, 0f})));

        assertEquals(2, e.getExpected());
        assertEquals(3, e.getActual());
        assertTrue(index.isEmpty());
    }

    @Test
    void testQueryDimensionMismatch() {
        VectorIndex index = VectorIndex.of(List.of(new float[]{1f, 0f}));

        assertThrows(IllegalArgumentException.class, () -> index.search(new float[]{1f, 0f, 0f}, 1));
    }

    @Test
    void testRebuildReplacesRows() {
        VectorIndex index = VectorIndex.of(List.of(new float[]{1f, 0f}, new float[]{0f, 1f}));

        index.build(List.of(new float[]{0f, 0f, 1f}));

        assertEquals(1, index.size());
        assertEquals(3, index.dimensions());
    }

    @Test
    void testVectorsAreNormalizedCopies() {
        VectorIndex index = VectorIndex.of(List.of(new float[]{3f, 4f}));

        float[] stored = index.vectors().get(0);
        stored[0] = 100f;

        assertArrayEquals(new float[]{0.6f, 0.8f}, index.vectors().get(0), 1e-6f);
    }
}
