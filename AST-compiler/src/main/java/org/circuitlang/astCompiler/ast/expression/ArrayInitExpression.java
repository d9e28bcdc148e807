package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.ArrayDimensions;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** [element; dimensions] */
public final class ArrayInitExpression extends Expression {
    public final Expression element;
    public final ArrayDimensions dimensions;

    public ArrayInitExpression(Expression element, ArrayDimensions dimensions, Span span) {
        super(span);
        this.element = element;
        this.dimensions = dimensions;
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceArrayInit(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("element", this.element.toJson(mapper));
        result.set("dimensions", this.dimensions.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("[")
                .append(this.element)
                .append("; ")
                .append(this.dimensions.toString())
                .append("]");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ArrayInitExpression that = (ArrayInitExpression) o;
        return this.element.equals(that.element) &&
                this.dimensions.equals(that.dimensions) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.element, this.dimensions, this.span);
    }
}
