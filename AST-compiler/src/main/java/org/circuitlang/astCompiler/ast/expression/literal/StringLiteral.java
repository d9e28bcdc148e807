package org.circuitlang.astCompiler.ast.expression.literal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class StringLiteral extends ValueExpression {
    public final List<Char> characters;

    public StringLiteral(List<Char> characters, Span span) {
        super(span);
        this.characters = List.copyOf(characters);
    }

    public static StringLiteral of(String value, Span span) {
        List<Char> chars = new ArrayList<>();
        value.codePoints().forEach(c -> chars.add(Char.of(c)));
        return new StringLiteral(chars, span);
    }

    @Override
    public Expression reconstructValue(ReconstructingDirector director) {
        return director.reduceString(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        ArrayNode chars = result.putArray("characters");
        for (Char c: this.characters)
            chars.add(c.codePoint);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        StringBuilder text = new StringBuilder();
        for (Char c: this.characters)
            text.append(c);
        return builder.append("\"")
                .append(text.toString())
                .append("\"");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        StringLiteral that = (StringLiteral) o;
        return this.characters.equals(that.characters) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.characters, this.span);
    }
}
