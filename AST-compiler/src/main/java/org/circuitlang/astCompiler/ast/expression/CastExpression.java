package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class CastExpression extends Expression {
    public final Expression inner;
    public final Type targetType;

    public CastExpression(Expression inner, Type targetType, Span span) {
        super(span);
        this.inner = inner;
        this.targetType = targetType;
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceCast(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("inner", this.inner.toJson(mapper));
        result.set("targetType", this.targetType.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.inner)
                .append(" as ")
                .append(this.targetType)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CastExpression that = (CastExpression) o;
        return this.inner.equals(that.inner) &&
                this.targetType.equals(that.targetType) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.inner, this.targetType, this.span);
    }
}
