package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class ConsoleStatement extends Statement {
    public final ConsoleFunction function;

    public ConsoleStatement(ConsoleFunction function, Span span) {
        super(span);
        this.function = function;
    }

    @Override
    public Statement reconstruct(ReconstructingDirector director) {
        return director.reduceConsole(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("function", this.function.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("console.")
                .append(this.function)
                .append(";");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ConsoleStatement that = (ConsoleStatement) o;
        return this.function.equals(that.function) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.function, this.span);
    }
}
