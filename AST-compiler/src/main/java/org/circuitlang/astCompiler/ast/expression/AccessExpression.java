package org.circuitlang.astCompiler.ast.expression;

import org.circuitlang.astCompiler.ast.Span;

/** Expressions that select a part of another value. */
public abstract class AccessExpression extends Expression {
    protected AccessExpression(Span span) {
        super(span);
    }
}
