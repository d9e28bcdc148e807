package org.circuitlang.astCompiler.ast.statement;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

public abstract class Statement extends AstNode {
    protected Statement(Span span) {
        super(span);
    }

    public abstract Statement reconstruct(ReconstructingDirector director);
}
