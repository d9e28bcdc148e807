package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** array[left..right]; either bound may be missing. */
public final class ArrayRangeAccess extends AccessExpression {
    public final Expression array;
    @Nullable
    public final Expression left;
    @Nullable
    public final Expression right;

    public ArrayRangeAccess(Expression array, @Nullable Expression left, @Nullable Expression right, Span span) {
        super(span);
        this.array = array;
        this.left = left;
        this.right = right;
    }

    @Override
    public ArrayRangeAccess reconstruct(ReconstructingDirector director) {
        return director.reduceArrayRangeAccess(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("array", this.array.toJson(mapper));
        result.set("left", nullableToJson(this.left, mapper));
        result.set("right", nullableToJson(this.right, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.array)
                .append("[");
        if (this.left != null)
            builder.append(this.left);
        builder.append("..");
        if (this.right != null)
            builder.append(this.right);
        return builder.append("]");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ArrayRangeAccess that = (ArrayRangeAccess) o;
        return this.array.equals(that.array) &&
                Objects.equals(this.left, that.left) &&
                Objects.equals(this.right, that.right) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.array, this.left, this.right, this.span);
    }
}
