package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** The left-hand side of an assignment: a variable followed by accesses. */
public final class Assignee extends AstNode {
    public final Identifier identifier;
    public final List<AssigneeAccess> accesses;

    public Assignee(Identifier identifier, List<AssigneeAccess> accesses, Span span) {
        super(span);
        this.identifier = identifier;
        this.accesses = List.copyOf(accesses);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("identifier", this.identifier.toJson(mapper));
        result.set("accesses", listToJson(this.accesses, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.identifier);
        for (AssigneeAccess access: this.accesses)
            builder.append(access);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Assignee that = (Assignee) o;
        return this.identifier.equals(that.identifier) &&
                this.accesses.equals(that.accesses) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.identifier, this.accesses, this.span);
    }
}
