package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** Name { member: value, ... } */
public final class CircuitInitExpression extends Expression {
    public final Identifier name;
    public final List<CircuitVariableInitializer> members;

    public CircuitInitExpression(Identifier name, List<CircuitVariableInitializer> members, Span span) {
        super(span);
        this.name = name;
        this.members = List.copyOf(members);
    }

    @Override
    public Expression reconstruct(ReconstructingDirector director) {
        return director.reduceCircuitInit(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("name", this.name.toJson(mapper));
        result.set("members", listToJson(this.members, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name)
                .append(" { ")
                .joinI(", ", this.members)
                .append(" }");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CircuitInitExpression that = (CircuitInitExpression) o;
        return this.name.equals(that.name) &&
                this.members.equals(that.members) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.members, this.span);
    }
}
