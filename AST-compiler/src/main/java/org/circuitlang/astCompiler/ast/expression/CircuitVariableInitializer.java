package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** One member in a circuit initializer.  A missing expression is the
 * shorthand form where the member takes the value of the variable with
 * the same name.  Its span is the span of the member name. */
public final class CircuitVariableInitializer extends AstNode {
    public final Identifier identifier;
    @Nullable
    public final Expression expression;

    public CircuitVariableInitializer(Identifier identifier, @Nullable Expression expression) {
        super(identifier.span);
        this.identifier = identifier;
        this.expression = expression;
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("identifier", this.identifier.toJson(mapper));
        result.set("expression", nullableToJson(this.expression, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.identifier);
        if (this.expression != null)
            builder.append(": ").append(this.expression);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CircuitVariableInitializer that = (CircuitVariableInitializer) o;
        return this.identifier.equals(that.identifier) &&
                Objects.equals(this.expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.identifier, this.expression);
    }
}
