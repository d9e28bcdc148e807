package org.circuitlang.astCompiler.ast.type;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

/** Base class for all types.  Types carry no span of their own;
 * reductions receive the span of the node that contains them. */
public abstract class Type extends AstNode {
    protected Type() {
        super(Span.NONE);
    }

    /** Rebuild this type from its reduced components.
     * @param span  Span of the node that contains the type. */
    public abstract Type reconstruct(ReconstructingDirector director, Span span);
}
