package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.PositiveNumber;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** tuple.index */
public final class TupleAccess extends AccessExpression {
    public final Expression tuple;
    public final PositiveNumber index;

    public TupleAccess(Expression tuple, PositiveNumber index, Span span) {
        super(span);
        this.tuple = tuple;
        this.index = index;
    }

    @Override
    public TupleAccess reconstruct(ReconstructingDirector director) {
        return director.reduceTupleAccess(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("tuple", this.tuple.toJson(mapper));
        result.put("index", this.index.value);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.tuple)
                .append(".")
                .append(this.index.value);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        TupleAccess that = (TupleAccess) o;
        return this.tuple.equals(that.tuple) &&
                this.index.equals(that.index) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.tuple, this.index, this.span);
    }
}
