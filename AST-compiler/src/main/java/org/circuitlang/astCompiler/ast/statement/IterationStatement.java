package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** for variable: type in start..stop { block } */
public final class IterationStatement extends Statement {
    public final Identifier variable;
    public final Type type;
    public final Expression start;
    public final Expression stop;
    /** True for start..=stop */
    public final boolean inclusive;
    public final Block block;

    public IterationStatement(Identifier variable, Type type, Expression start, Expression stop,
                              boolean inclusive, Block block, Span span) {
        super(span);
        this.variable = variable;
        this.type = type;
        this.start = start;
        this.stop = stop;
        this.inclusive = inclusive;
        this.block = block;
    }

    @Override
    public Statement reconstruct(ReconstructingDirector director) {
        return director.reduceIteration(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("variable", this.variable.toJson(mapper));
        result.set("type", this.type.toJson(mapper));
        result.set("start", this.start.toJson(mapper));
        result.set("stop", this.stop.toJson(mapper));
        result.put("inclusive", this.inclusive);
        result.set("block", this.block.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("for ")
                .append(this.variable)
                .append(": ")
                .append(this.type)
                .append(" in ")
                .append(this.start)
                .append(this.inclusive ? "..=" : "..")
                .append(this.stop)
                .append(" ")
                .append(this.block);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        IterationStatement that = (IterationStatement) o;
        return this.variable.equals(that.variable) &&
                this.type.equals(that.type) &&
                this.start.equals(that.start) &&
                this.stop.equals(that.stop) &&
                this.inclusive == that.inclusive &&
                this.block.equals(that.block) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.variable, this.type, this.start, this.stop,
                this.inclusive, this.block, this.span);
    }
}
