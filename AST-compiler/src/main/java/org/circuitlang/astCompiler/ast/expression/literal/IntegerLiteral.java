package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.type.IntegerType;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class IntegerLiteral extends ValueExpression {
    public final IntegerType integerType;
    public final String value;

    public IntegerLiteral(IntegerType integerType, String value, Span span) {
        super(span);
        this.integerType = integerType;
        this.value = value;
    }

    @Override
    public Expression reconstructValue(ReconstructingDirector director) {
        return director.reduceLiteral(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("integerType", this.integerType.name());
        result.put("value", this.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value)
                .append(this.integerType.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        IntegerLiteral that = (IntegerLiteral) o;
        return this.integerType == that.integerType &&
                this.value.equals(that.value) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.integerType, this.value, this.span);
    }
}
