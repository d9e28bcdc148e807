package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.literal.Char;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** A format string and the values substituted into its {} holes. */
public final class ConsoleArgs extends AstNode {
    public final List<Char> string;
    public final List<Expression> parameters;

    public ConsoleArgs(List<Char> string, List<Expression> parameters, Span span) {
        super(span);
        this.string = List.copyOf(string);
        this.parameters = List.copyOf(parameters);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        ArrayNode chars = result.putArray("string");
        for (Char c: this.string)
            chars.add(c.codePoint);
        result.set("parameters", listToJson(this.parameters, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        StringBuilder text = new StringBuilder();
        for (Char c: this.string)
            text.append(c);
        builder.append("\"").append(text.toString()).append("\"");
        for (Expression parameter: this.parameters)
            builder.append(", ").append(parameter);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ConsoleArgs that = (ConsoleArgs) o;
        return this.string.equals(that.string) &&
                this.parameters.equals(that.parameters) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.string, this.parameters, this.span);
    }
}
