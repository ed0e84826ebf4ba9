package io.repo.vectors;

/**
 * Thrown when vectors and chunks no longer line up: non-uniform vector
 * dimensions, or a row count that differs from the chunk count.
 *
 * <p>The index it concerns must be rebuilt.</p>
 */
public class IndexIntegrityException extends RuntimeException {

    private final int expected;
    private final int actual;

    public IndexIntegrityException(String what, int expected, int actual) {
        super(String.format("Index integrity violated: %s expected %d, got %d", what, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
