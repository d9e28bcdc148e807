package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** A circuit declaration; its span is the span of its name. */
public final class Circuit extends AstNode {
    public final Identifier circuitName;
    public final List<CircuitMember> members;

    public Circuit(Identifier circuitName, List<CircuitMember> members) {
        super(circuitName.span);
        this.circuitName = circuitName;
        this.members = List.copyOf(members);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("circuitName", this.circuitName.toJson(mapper));
        result.set("members", listToJson(this.members, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("circuit ")
                .append(this.circuitName)
                .append(" {")
                .increase();
        for (CircuitMember member: this.members)
            builder.append(member).newline();
        return builder.decrease().append("}");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Circuit that = (Circuit) o;
        return this.circuitName.equals(that.circuitName) && this.members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.circuitName, this.members);
    }
}
