package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

public final class CallExpression extends Expression {
    public final Expression function;
    public final List<Expression> arguments;

    public CallExpression(Expression function, List<Expression> arguments, Span span) {
        super(span);
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceCall(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("function", this.function.toJson(mapper));
        result.set("arguments", listToJson(this.arguments, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.function)
                .append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CallExpression that = (CallExpression) o;
        return this.function.equals(that.function) &&
                this.arguments.equals(that.arguments) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.function, this.arguments, this.span);
    }
}
