package org.circuitlang.astCompiler.ast.expression.literal;

import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

/** Base class for literal values. */
public abstract class ValueExpression extends Expression {
    protected ValueExpression(Span span) {
        super(span);
    }

    @Override
    public final Expression reconstruct(ReconstructingDirector director) {
        return director.reduceValue(this);
    }

    /** Rebuild the value itself; the result is handed to the
     * value reduction hook together with this node. */
    public abstract Expression reconstructValue(ReconstructingDirector director);
}
