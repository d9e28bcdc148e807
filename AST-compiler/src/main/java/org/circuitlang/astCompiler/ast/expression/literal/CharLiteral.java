package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class CharLiteral extends ValueExpression {
    public final Char character;

    public CharLiteral(Char character, Span span) {
        super(span);
        this.character = character;
    }

    @Override
    public Expression reconstructValue(ReconstructingDirector director) {
        return director.reduceLiteral(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("codePoint", this.character.codePoint);
        result.put("scalar", this.character.scalar);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("'")
                .append(this.character.toString())
                .append("'");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        CharLiteral that = (CharLiteral) o;
        return this.character.equals(that.character) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.character, this.span);
    }
}
