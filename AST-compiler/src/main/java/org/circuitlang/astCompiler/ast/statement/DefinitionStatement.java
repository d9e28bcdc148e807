package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** let (a, b): type = value; */
public final class DefinitionStatement extends Statement {
    public enum Declare {
        CONST("const"),
        LET("let");

        public final String text;

        Declare(String text) {
            this.text = text;
        }
    }

    public final Declare declarationType;
    public final List<VariableName> variableNames;
    /** True if the names were written inside parentheses. */
    public final boolean parened;
    public final Type type;
    public final Expression value;

    public DefinitionStatement(Declare declarationType, List<VariableName> variableNames,
                               boolean parened, Type type, Expression value, Span span) {
        super(span);
        this.declarationType = declarationType;
        this.variableNames = List.copyOf(variableNames);
        this.parened = parened;
        this.type = type;
        this.value = value;
    }

    @Override
    public Statement reconstruct(ReconstructingDirector director) {
        return director.reduceDefinition(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("declarationType", this.declarationType.name());
        result.set("variableNames", listToJson(this.variableNames, mapper));
        result.put("parened", this.parened);
        result.set("type", this.type.toJson(mapper));
        result.set("value", this.value.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.declarationType.text)
                .append(" ");
        if (this.parened)
            builder.append("(");
        builder.joinI(", ", this.variableNames);
        if (this.parened)
            builder.append(")");
        return builder.append(": ")
                .append(this.type)
                .append(" = ")
                .append(this.value)
                .append(";");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        DefinitionStatement that = (DefinitionStatement) o;
        return this.declarationType == that.declarationType &&
                this.variableNames.equals(that.variableNames) &&
                this.parened == that.parened &&
                this.type.equals(that.type) &&
                this.value.equals(that.value) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.declarationType, this.variableNames, this.parened,
                this.type, this.value, this.span);
    }
}
