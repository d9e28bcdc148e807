package org.circuitlang.astCompiler.ast.program;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

/** A function parameter: a typed variable or a form of the self keyword. */
public abstract class FunctionInput extends AstNode {
    protected FunctionInput(Span span) {
        super(span);
    }

    public abstract FunctionInput reconstruct(ReconstructingDirector director);
}
