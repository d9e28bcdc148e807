package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

public final class TupleInitExpression extends Expression {
    public final List<Expression> elements;

    public TupleInitExpression(List<Expression> elements, Span span) {
        super(span);
        this.elements = List.copyOf(elements);
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceTupleInit(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("elements", listToJson(this.elements, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .joinI(", ", this.elements)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        TupleInitExpression that = (TupleInitExpression) o;
        return this.elements.equals(that.elements) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.elements, this.span);
    }
}
