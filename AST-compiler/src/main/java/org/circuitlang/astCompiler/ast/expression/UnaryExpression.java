package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class UnaryExpression extends Expression {
    public final Expression inner;
    public final UnaryOperation operation;

    public UnaryExpression(Expression inner, UnaryOperation operation, Span span) {
        super(span);
        this.inner = inner;
        this.operation = operation;
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceUnary(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("inner", this.inner.toJson(mapper));
        result.put("operation", this.operation.name());
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.operation.text)
                .append(this.inner);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        UnaryExpression that = (UnaryExpression) o;
        return this.inner.equals(that.inner) &&
                this.operation == that.operation &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.inner, this.operation, this.span);
    }
}
