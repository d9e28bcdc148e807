package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** A sequence of statements between braces. */
public final class Block extends Statement {
    public final List<Statement> statements;

    public Block(List<Statement> statements, Span span) {
        super(span);
        this.statements = List.copyOf(statements);
    }

    @Override
    public Block reconstruct(ReconstructingDirector director) {
        return director.reduceBlock(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("statements", listToJson(this.statements, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.statements.isEmpty())
            return builder.append("{}");
        builder.append("{").increase();
        for (Statement statement: this.statements)
            builder.append(statement).newline();
        return builder.decrease().append("}");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Block that = (Block) o;
        return this.statements.equals(that.statements) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.statements, this.span);
    }
}
