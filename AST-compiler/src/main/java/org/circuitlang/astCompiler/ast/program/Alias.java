package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** type name = represents; */
public final class Alias extends AstNode {
    public final Identifier name;
    public final Type represents;

    public Alias(Identifier name, Type represents, Span span) {
        super(span);
        this.name = name;
        this.represents = represents;
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("name", this.name.toJson(mapper));
        result.set("represents", this.represents.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("type ")
                .append(this.name)
                .append(" = ")
                .append(this.represents)
                .append(";");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Alias that = (Alias) o;
        return this.name.equals(that.name) &&
                this.represents.equals(that.represents) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.represents, this.span);
    }
}
