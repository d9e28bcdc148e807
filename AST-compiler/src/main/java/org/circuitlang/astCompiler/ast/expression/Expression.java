package org.circuitlang.astCompiler.ast.expression;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

/** Base class for all expressions. */
public abstract class Expression extends AstNode {
    protected Expression(Span span) {
        super(span);
    }

    /** Rebuild this expression by reducing its children with the director.
     * Each subclass dispatches to the director method for its own kind. */
    public abstract Expression reconstruct(ReconstructingDirector director);
}
