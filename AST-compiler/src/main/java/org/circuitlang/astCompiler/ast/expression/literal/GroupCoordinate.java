package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;

import javax.annotation.Nullable;
import java.util.Objects;

/** One coordinate of a group tuple.  Not reducible. */
public final class GroupCoordinate {
    public enum Kind {
        NUMBER,
        /** + */
        SIGN_HIGH,
        /** - */
        SIGN_LOW,
        /** _ */
        INFERRED
    }

    public final Kind kind;
    /** Present only for {@link Kind#NUMBER}. */
    @Nullable
    public final String number;
    public final Span span;

    public GroupCoordinate(Kind kind, @Nullable String number, Span span) {
        this.kind = kind;
        this.number = number;
        this.span = span;
    }

    public static GroupCoordinate number(String number, Span span) {
        return new GroupCoordinate(Kind.NUMBER, number, span);
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("kind", this.kind.name());
        if (this.number != null)
            result.put("number", this.number);
        if (this.span.isKnown())
            result.set("span", this.span.toJson(mapper));
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GroupCoordinate that = (GroupCoordinate) o;
        return this.kind == that.kind &&
                Objects.equals(this.number, that.number) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.number, this.span);
    }

    @Override
    public String toString() {
        switch (this.kind) {
            case NUMBER:
                return Objects.requireNonNull(this.number);
            case SIGN_HIGH:
                return "+";
            case SIGN_LOW:
                return "-";
            case INFERRED:
            default:
                return "_";
        }
    }
}
