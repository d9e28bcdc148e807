package org.circuitlang.astCompiler.compiler.reducer;

import org.circuitlang.astCompiler.ast.program.Program;
import org.circuitlang.astCompiler.compiler.AstCompiler;
import org.circuitlang.util.IWritesLogs;
import org.circuitlang.util.Linq;
import org.circuitlang.util.Logger;

import java.util.List;

/** Applies multiple reducers in sequence; each one sees the result of the previous one. */
public class ReducerPasses implements IWritesLogs {
    public final List<ReconstructingReducer> passes;

    public ReducerPasses(ReconstructingReducer... passes) {
        this(Linq.list(passes));
    }

    public ReducerPasses(List<ReconstructingReducer> passes) {
        this.passes = passes;
    }

    public void add(ReconstructingReducer pass) {
        this.passes.add(pass);
    }

    public Program apply(AstCompiler compiler, Program program) {
        for (ReconstructingReducer pass: this.passes) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Executing ")
                    .appendSupplier(pass::toString)
                    .newline();
            program = new ReconstructingDirector(compiler, pass).apply(program);
            final Program result = program;
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("After ")
                    .appendSupplier(pass::toString)
                    .newline()
                    .appendSupplier(result::toString)
                    .newline();
        }
        return program;
    }

    @Override
    public String toString() {
        return super.toString() + this.passes;
    }
}
