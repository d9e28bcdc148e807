package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** array[index] */
public final class ArrayAccess extends AccessExpression {
    public final Expression array;
    public final Expression index;

    public ArrayAccess(Expression array, Expression index, Span span) {
        super(span);
        this.array = array;
        this.index = index;
    }

    @Override
    public ArrayAccess reconstruct(ReconstructingDirector director) {
        return director.reduceArrayAccess(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("array", this.array.toJson(mapper));
        result.set("index", this.index.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.array)
                .append("[")
                .append(this.index)
                .append("]");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ArrayAccess that = (ArrayAccess) o;
        return this.array.equals(that.array) &&
                this.index.equals(that.index) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.array, this.index, this.span);
    }
}
