package org.circuitlang.astCompiler.compiler.reducer;

/**
 * Sets the in-circuit flag of a reducer while open and restores the
 * previous value on close, including when the body throws.
 * Use in a try-with-resources statement.
 */
public final class CircuitScope implements AutoCloseable {
    private final ReconstructingReducer reducer;
    private final boolean previous;

    CircuitScope(ReconstructingReducer reducer) {
        this.reducer = reducer;
        this.previous = reducer.inCircuit();
        if (!this.previous)
            reducer.swapInCircuit();
    }

    @Override
    public void close() {
        if (this.reducer.inCircuit() != this.previous)
            this.reducer.swapInCircuit();
    }
}
