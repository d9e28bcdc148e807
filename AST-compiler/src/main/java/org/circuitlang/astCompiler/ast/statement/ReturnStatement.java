package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class ReturnStatement extends Statement {
    public final Expression expression;

    public ReturnStatement(Expression expression, Span span) {
        super(span);
        this.expression = expression;
    }

    @Override
    public Statement reconstruct(ReconstructingDirector director) {
        return director.reduceReturn(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("expression", this.expression.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("return ")
                .append(this.expression)
                .append(";");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ReturnStatement that = (ReturnStatement) o;
        return this.expression.equals(that.expression) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.expression, this.span);
    }
}
