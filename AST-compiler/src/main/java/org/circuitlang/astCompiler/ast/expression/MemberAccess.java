package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** inner.name; the type of the member is known only after type inference. */
public final class MemberAccess extends AccessExpression {
    public final Expression inner;
    public final Identifier name;
    @Nullable
    public final Type type;

    public MemberAccess(Expression inner, Identifier name, @Nullable Type type, Span span) {
        super(span);
        this.inner = inner;
        this.name = name;
        this.type = type;
    }

    @Override
    public MemberAccess reconstruct(ReconstructingDirector director) {
        return director.reduceMemberAccess(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("inner", this.inner.toJson(mapper));
        result.set("name", this.name.toJson(mapper));
        result.set("type", nullableToJson(this.type, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.inner)
                .append(".")
                .append(this.name);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        MemberAccess that = (MemberAccess) o;
        return this.inner.equals(that.inner) &&
                this.name.equals(that.name) &&
                Objects.equals(this.type, that.type) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.inner, this.name, this.type, this.span);
    }
}
