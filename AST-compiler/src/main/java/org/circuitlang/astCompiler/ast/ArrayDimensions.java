package org.circuitlang.astCompiler.ast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** The dimensions of an array type or array initializer. Not reducible. */
public final class ArrayDimensions {
    /** One dimension; the number is absent when the size is left unspecified. */
    public static final class Dimension {
        public static final Dimension UNSPECIFIED = new Dimension(null);

        @Nullable
        public final PositiveNumber number;

        public Dimension(@Nullable PositiveNumber number) {
            this.number = number;
        }

        public boolean isSpecified() {
            return this.number != null;
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            return Objects.equals(this.number, ((Dimension) o).number);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(this.number);
        }

        @Override
        public String toString() {
            return this.number == null ? "_" : this.number.toString();
        }
    }

    public final List<Dimension> dimensions;

    public ArrayDimensions(List<Dimension> dimensions) {
        this.dimensions = List.copyOf(dimensions);
    }

    public static ArrayDimensions of(int... sizes) {
        return new ArrayDimensions(Arrays.stream(sizes)
                .mapToObj(s -> new Dimension(new PositiveNumber(s)))
                .collect(Collectors.toList()));
    }

    public ArrayNode toJson(ObjectMapper mapper) {
        ArrayNode result = mapper.createArrayNode();
        for (Dimension dimension: this.dimensions) {
            if (dimension.number == null)
                result.addNull();
            else
                result.add(dimension.number.value);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.dimensions.equals(((ArrayDimensions) o).dimensions);
    }

    @Override
    public int hashCode() {
        return this.dimensions.hashCode();
    }

    @Override
    public String toString() {
        if (this.dimensions.size() == 1)
            return this.dimensions.get(0).toString();
        return this.dimensions.stream().map(Dimension::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
