package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class BinaryExpression extends Expression {
    public final Expression left;
    public final Expression right;
    public final BinaryOperation operation;

    public BinaryExpression(Expression left, Expression right, BinaryOperation operation, Span span) {
        super(span);
        this.left = left;
        this.right = right;
        this.operation = operation;
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceBinary(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("left", this.left.toJson(mapper));
        result.set("right", this.right.toJson(mapper));
        result.put("operation", this.operation.name());
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.operation.text)
                .append(" ")
                .append(this.right)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        BinaryExpression that = (BinaryExpression) o;
        return this.left.equals(that.left) &&
                this.right.equals(that.right) &&
                this.operation == that.operation &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.left, this.right, this.operation, this.span);
    }
}
