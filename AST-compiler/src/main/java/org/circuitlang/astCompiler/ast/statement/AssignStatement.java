package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class AssignStatement extends Statement {
    public final AssignOperation operation;
    public final Assignee assignee;
    public final Expression value;

    public AssignStatement(AssignOperation operation, Assignee assignee, Expression value, Span span) {
        super(span);
        this.operation = operation;
        this.assignee = assignee;
        this.value = value;
    }

    @Override
    public Statement reconstruct(ReconstructingDirector director) {
        return director.reduceAssign(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("operation", this.operation.name());
        result.set("assignee", this.assignee.toJson(mapper));
        result.set("value", this.value.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.assignee)
                .append(" ")
                .append(this.operation.text)
                .append(" ")
                .append(this.value)
                .append(";");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        AssignStatement that = (AssignStatement) o;
        return this.operation == that.operation &&
                this.assignee.equals(that.assignee) &&
                this.value.equals(that.value) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.operation, this.assignee, this.value, this.span);
    }
}
