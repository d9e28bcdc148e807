package org.circuitlang.astCompiler.ast.expression;

public enum BinaryOperation {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("**"),
    OR("||"),
    AND("&&"),
    EQ("=="),
    NE("!="),
    GE(">="),
    GT(">"),
    LE("<="),
    LT("<"),
    BIT_OR("|"),
    BIT_AND("&"),
    BIT_XOR("^"),
    SHR(">>"),
    SHR_SIGNED(">>>"),
    SHL("<<");

    public final String text;

    BinaryOperation(String text) {
        this.text = text;
    }

    public boolean isComparison() {
        switch (this) {
            case EQ:
            case NE:
            case GE:
            case GT:
            case LE:
            case LT:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return this.text;
    }
}
