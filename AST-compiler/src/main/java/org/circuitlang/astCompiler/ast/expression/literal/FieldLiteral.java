package org.circuitlang.astCompiler.ast.expression.literal;

import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.util.IIndentStream;

public final class FieldLiteral extends TextLiteral {
    public FieldLiteral(String value, Span span) {
        super(value, span);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value).append("field");
    }
}
