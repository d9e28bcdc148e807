package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** @name(arguments) before a function. */
public final class Annotation extends AstNode {
    public final Identifier name;
    public final List<String> arguments;

    public Annotation(Identifier name, List<String> arguments, Span span) {
        super(span);
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("name", this.name.toJson(mapper));
        ArrayNode args = result.putArray("arguments");
        for (String argument: this.arguments)
            args.add(argument);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("@")
                .append(this.name);
        if (!this.arguments.isEmpty())
            builder.append("(")
                    .join(", ", this.arguments)
                    .append(")");
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Annotation that = (Annotation) o;
        return this.name.equals(that.name) &&
                this.arguments.equals(that.arguments) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.arguments, this.span);
    }
}
