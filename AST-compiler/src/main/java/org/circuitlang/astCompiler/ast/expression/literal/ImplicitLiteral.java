package org.circuitlang.astCompiler.ast.expression.literal;

import org.circuitlang.astCompiler.ast.Span;

/** A number whose type is not written in the source and has to be inferred. */
public final class ImplicitLiteral extends TextLiteral {
    public ImplicitLiteral(String value, Span span) {
        super(value, span);
    }
}
