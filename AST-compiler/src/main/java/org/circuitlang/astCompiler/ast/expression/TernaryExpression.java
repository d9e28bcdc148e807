package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** condition ? ifTrue : ifFalse */
public final class TernaryExpression extends Expression {
    public final Expression condition;
    public final Expression ifTrue;
    public final Expression ifFalse;

    public TernaryExpression(Expression condition, Expression ifTrue, Expression ifFalse, Span span) {
        super(span);
        this.condition = condition;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceTernary(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("condition", this.condition.toJson(mapper));
        result.set("ifTrue", this.ifTrue.toJson(mapper));
        result.set("ifFalse", this.ifFalse.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.condition)
                .append(" ? ")
                .append(this.ifTrue)
                .append(" : ")
                .append(this.ifFalse)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        TernaryExpression that = (TernaryExpression) o;
        return this.condition.equals(that.condition) &&
                this.ifTrue.equals(that.ifTrue) &&
                this.ifFalse.equals(that.ifFalse) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.condition, this.ifTrue, this.ifFalse, this.span);
    }
}
