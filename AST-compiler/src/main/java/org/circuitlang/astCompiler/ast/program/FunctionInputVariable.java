package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class FunctionInputVariable extends FunctionInput {
    public final Identifier identifier;
    public final boolean isConst;
    public final boolean mutable;
    public final Type type;

    public FunctionInputVariable(Identifier identifier, boolean isConst, boolean mutable, Type type, Span span) {
        super(span);
        this.identifier = identifier;
        this.isConst = isConst;
        this.mutable = mutable;
        this.type = type;
    }

    @Override
    public FunctionInput reconstruct(ReconstructingDirector director) {
        return director.reduceFunctionInputVariable(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("identifier", this.identifier.toJson(mapper));
        result.put("isConst", this.isConst);
        result.put("mutable", this.mutable);
        result.set("type", this.type.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.isConst)
            builder.append("const ");
        if (this.mutable)
            builder.append("mut ");
        return builder.append(this.identifier)
                .append(": ")
                .append(this.type);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        FunctionInputVariable that = (FunctionInputVariable) o;
        return this.identifier.equals(that.identifier) &&
                this.isConst == that.isConst &&
                this.mutable == that.mutable &&
                this.type.equals(that.type) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.identifier, this.isConst, this.mutable, this.type, this.span);
    }
}
