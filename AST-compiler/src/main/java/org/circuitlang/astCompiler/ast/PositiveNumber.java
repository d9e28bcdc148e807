package org.circuitlang.astCompiler.ast;

/** A non-negative integer literal kept in its source form,
 * used for tuple indexes and array dimensions. */
public final class PositiveNumber {
    public final String value;

    public PositiveNumber(String value) {
        this.value = value;
    }

    public PositiveNumber(int value) {
        this(Integer.toString(value));
    }

    public boolean isZero() {
        return this.value.chars().allMatch(c -> c == '0');
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.value.equals(((PositiveNumber) o).value);
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }

    @Override
    public String toString() {
        return this.value;
    }
}
