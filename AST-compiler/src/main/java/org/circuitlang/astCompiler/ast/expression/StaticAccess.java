package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.Cell;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/**
 * inner::name.  The type of the accessed value is resolved after the
 * node is built, so it lives in a {@link Cell} that later passes may set.
 */
public final class StaticAccess extends AccessExpression {
    public final Expression inner;
    public final Identifier name;
    public final Cell<Type> type;

    public StaticAccess(Expression inner, Identifier name, Cell<Type> type, Span span) {
        super(span);
        this.inner = inner;
        this.name = name;
        this.type = type;
    }

    @Override
    public StaticAccess reconstruct(ReconstructingDirector director) {
        return director.reduceStaticAccess(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("inner", this.inner.toJson(mapper));
        result.set("name", this.name.toJson(mapper));
        result.set("type", nullableToJson(this.type.get(), mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.inner)
                .append("::")
                .append(this.name);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        StaticAccess that = (StaticAccess) o;
        return this.inner.equals(that.inner) &&
                this.name.equals(that.name) &&
                this.type.equals(that.type) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.inner, this.name, this.span);
    }
}
