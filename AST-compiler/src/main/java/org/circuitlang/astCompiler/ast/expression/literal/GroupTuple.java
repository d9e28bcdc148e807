package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** (x, y)group */
public final class GroupTuple extends GroupValue {
    public final GroupCoordinate x;
    public final GroupCoordinate y;

    public GroupTuple(GroupCoordinate x, GroupCoordinate y, Span span) {
        super(span);
        this.x = x;
        this.y = y;
    }

    @Override
    public GroupValue reconstruct(ReconstructingDirector director) {
        return director.reduceGroupTuple(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("x", this.x.toJson(mapper));
        result.set("y", this.y.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.x.toString())
                .append(", ")
                .append(this.y.toString())
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GroupTuple that = (GroupTuple) o;
        return this.x.equals(that.x) && this.y.equals(that.y) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.x, this.y, this.span);
    }
}
