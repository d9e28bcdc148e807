package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

/** console.assert(expression); its span is the span of the expression. */
public final class ConsoleAssert extends ConsoleFunction {
    public final Expression expression;

    public ConsoleAssert(Expression expression) {
        super(expression.span);
        this.expression = expression;
    }

    @Override
    public ConsoleFunction reconstruct(ReconstructingDirector director) {
        return director.reduceConsoleAssert(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("expression", this.expression.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("assert(")
                .append(this.expression)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.expression.equals(((ConsoleAssert) o).expression);
    }

    @Override
    public int hashCode() {
        return this.expression.hashCode();
    }
}
