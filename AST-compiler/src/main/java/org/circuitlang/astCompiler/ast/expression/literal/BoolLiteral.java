package org.circuitlang.astCompiler.ast.expression.literal;

import org.circuitlang.astCompiler.ast.Span;

public final class BoolLiteral extends TextLiteral {
    public BoolLiteral(String value, Span span) {
        super(value, span);
    }

    public BoolLiteral(boolean value, Span span) {
        this(Boolean.toString(value), span);
    }

    public boolean getValue() {
        return Boolean.parseBoolean(this.value);
    }
}
