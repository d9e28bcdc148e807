package org.circuitlang.astCompiler.ast.expression;

public enum UnaryOperation {
    NOT("!"),
    NEGATE("-"),
    BIT_NOT("~");

    public final String text;

    UnaryOperation(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
