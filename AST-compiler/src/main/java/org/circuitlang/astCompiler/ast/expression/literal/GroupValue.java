package org.circuitlang.astCompiler.ast.expression.literal;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

/** The value of a group literal: a single number or an (x, y) pair. */
public abstract class GroupValue extends AstNode {
    protected GroupValue(Span span) {
        super(span);
    }

    public abstract GroupValue reconstruct(ReconstructingDirector director);
}
