package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** An element of an inline array: either an expression or ...expression.
 * Its span is the span of the expression. */
public final class SpreadOrExpression extends AstNode {
    public final boolean spread;
    public final Expression expression;

    public SpreadOrExpression(boolean spread, Expression expression) {
        super(expression.span);
        this.spread = spread;
        this.expression = expression;
    }

    public static SpreadOrExpression spread(Expression expression) {
        return new SpreadOrExpression(true, expression);
    }

    public static SpreadOrExpression expression(Expression expression) {
        return new SpreadOrExpression(false, expression);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("spread", this.spread);
        result.set("expression", this.expression.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.spread)
            builder.append("...");
        return builder.append(this.expression);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        SpreadOrExpression that = (SpreadOrExpression) o;
        return this.spread == that.spread && this.expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.spread, this.expression);
    }
}
