package org.circuitlang.astCompiler.ast.expression.literal;

import org.circuitlang.astCompiler.ast.Span;

/** An account address in its bech32 form. */
public final class AddressLiteral extends TextLiteral {
    public AddressLiteral(String value, Span span) {
        super(value, span);
    }
}
