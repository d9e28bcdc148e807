package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** A variable introduced by a definition. */
public final class VariableName extends AstNode {
    public final boolean mutable;
    public final Identifier identifier;

    public VariableName(boolean mutable, Identifier identifier, Span span) {
        super(span);
        this.mutable = mutable;
        this.identifier = identifier;
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("mutable", this.mutable);
        result.set("identifier", this.identifier.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.mutable)
            builder.append("mut ");
        return builder.append(this.identifier);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        VariableName that = (VariableName) o;
        return this.mutable == that.mutable &&
                this.identifier.equals(that.identifier) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.mutable, this.identifier, this.span);
    }
}
