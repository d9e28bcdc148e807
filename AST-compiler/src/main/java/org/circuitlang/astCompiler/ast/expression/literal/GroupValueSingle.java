package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class GroupValueSingle extends GroupValue {
    public final String value;

    public GroupValueSingle(String value, Span span) {
        super(span);
        this.value = value;
    }

    @Override
    public GroupValue reconstruct(ReconstructingDirector director) {
        return director.reduceGroupValueSingle(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("value", this.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GroupValueSingle that = (GroupValueSingle) o;
        return this.value.equals(that.value) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.value, this.span);
    }
}
