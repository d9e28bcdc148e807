package org.circuitlang.astCompiler.ast.type;

/** Fixed-width integer kinds. */
public enum IntegerType {
    U8(8, false),
    U16(16, false),
    U32(32, false),
    U64(64, false),
    U128(128, false),
    I8(8, true),
    I16(16, true),
    I32(32, true),
    I64(64, true),
    I128(128, true);

    public final int width;
    public final boolean signed;

    IntegerType(int width, boolean signed) {
        this.width = width;
        this.signed = signed;
    }

    @Override
    public String toString() {
        return (this.signed ? "i" : "u") + this.width;
    }
}
