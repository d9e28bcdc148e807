package org.circuitlang.astCompiler.ast.statement;

public enum AssignOperation {
    ASSIGN("="),
    ADD("+="),
    SUB("-="),
    MUL("*="),
    DIV("/="),
    MOD("%="),
    POW("**="),
    OR("||="),
    AND("&&="),
    BIT_OR("|="),
    BIT_AND("&="),
    BIT_XOR("^="),
    SHR(">>="),
    SHR_SIGNED(">>>="),
    SHL("<<=");

    public final String text;

    AssignOperation(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
