package com.raditha.competitors.exception;

/**
 * The embedding model returned vectors of inconsistent width.
 * Usually means the model was swapped or misconfigured mid-run.
 */
public class DimensionMismatchException extends PipelineException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("embedding", String.format(
                "Embedding dimension mismatch: expected %d but the model returned %d", expected, actual));
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
