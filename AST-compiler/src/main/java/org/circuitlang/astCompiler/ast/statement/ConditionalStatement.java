package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** if condition { block } else next; next is a Block or another conditional. */
public final class ConditionalStatement extends Statement {
    public final Expression condition;
    public final Block block;
    @Nullable
    public final Statement next;

    public ConditionalStatement(Expression condition, Block block, @Nullable Statement next, Span span) {
        super(span);
        this.condition = condition;
        this.block = block;
        this.next = next;
    }

    @Override
    public Statement reconstruct(ReconstructingDirector director) {
        return director.reduceConditional(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("condition", this.condition.toJson(mapper));
        result.set("block", this.block.toJson(mapper));
        result.set("next", nullableToJson(this.next, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("if ")
                .append(this.condition)
                .append(" ")
                .append(this.block);
        if (this.next != null)
            builder.append(" else ").append(this.next);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ConditionalStatement that = (ConditionalStatement) o;
        return this.condition.equals(that.condition) &&
                this.block.equals(that.block) &&
                Objects.equals(this.next, that.next) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.condition, this.block, this.next, this.span);
    }
}
