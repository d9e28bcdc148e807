package org.circuitlang.astCompiler.compiler.reducer;

import org.circuitlang.util.IWritesLogs;

/**
 * Base class for reducers.  Holds the in-circuit flag.
 * Reducers are not thread-safe; use one instance per traversal.
 */
public abstract class AbstractReconstructingReducer implements ReconstructingReducer, IWritesLogs {
    private boolean inCircuit = false;

    @Override
    public boolean inCircuit() {
        return this.inCircuit;
    }

    @Override
    public void swapInCircuit() {
        this.inCircuit = !this.inCircuit;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
