package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

/** A group element; its span is the span of its value. */
public final class GroupLiteral extends ValueExpression {
    public final GroupValue value;

    public GroupLiteral(GroupValue value) {
        super(value.span);
        this.value = value;
    }

    @Override
    public Expression reconstructValue(ReconstructingDirector director) {
        return director.reduceGroupLiteral(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("value", this.value.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value)
                .append("group");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.value.equals(((GroupLiteral) o).value);
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }
}
