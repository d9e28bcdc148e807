package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

/** A literal kept as the source text that denotes it. */
public abstract class TextLiteral extends ValueExpression {
    public final String value;

    protected TextLiteral(String value, Span span) {
        super(span);
        this.value = value;
    }

    @Override
    public Expression reconstructValue(ReconstructingDirector director) {
        return director.reduceLiteral(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("value", this.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        TextLiteral that = (TextLiteral) o;
        return this.value.equals(that.value) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return 31 * this.value.hashCode() + this.span.hashCode();
    }
}
