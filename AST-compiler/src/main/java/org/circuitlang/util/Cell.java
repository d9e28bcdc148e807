package org.circuitlang.util;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A single updatable slot.  Used for the few tree fields that are
 * filled in after the owning node has been built.
 * Two cells are equal when their contents are equal.
 */
public final class Cell<T> {
    @Nullable
    private T value;

    public Cell(@Nullable T value) {
        this.value = value;
    }

    public static <T> Cell<T> empty() {
        return new Cell<>(null);
    }

    @Nullable
    public T get() {
        return this.value;
    }

    public boolean isSet() {
        return this.value != null;
    }

    public void set(@Nullable T value) {
        this.value = value;
    }

    /** A new cell holding the same value. */
    public Cell<T> copy() {
        return new Cell<>(this.value);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Cell<?> cell = (Cell<?>) o;
        return Objects.equals(this.value, cell.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.value);
    }

    @Override
    public String toString() {
        return "Cell(" + this.value + ")";
    }
}
