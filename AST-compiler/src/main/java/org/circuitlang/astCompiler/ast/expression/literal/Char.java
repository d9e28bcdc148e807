package org.circuitlang.astCompiler.ast.expression.literal;

/**
 * A character of a char or string literal.  Escapes may denote code
 * points that are not Unicode scalar values (surrogates); those are kept
 * as raw numbers.
 */
public final class Char {
    public final int codePoint;
    public final boolean scalar;

    public Char(int codePoint, boolean scalar) {
        this.codePoint = codePoint;
        this.scalar = scalar;
    }

    public static Char of(int codePoint) {
        boolean scalar = Character.isValidCodePoint(codePoint) &&
                !(codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE);
        return new Char(codePoint, scalar);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Char that = (Char) o;
        return this.codePoint == that.codePoint && this.scalar == that.scalar;
    }

    @Override
    public int hashCode() {
        return 31 * this.codePoint + (this.scalar ? 1 : 0);
    }

    @Override
    public String toString() {
        if (this.scalar)
            return new String(Character.toChars(this.codePoint));
        return "\\u{" + Integer.toHexString(this.codePoint) + "}";
    }
}
