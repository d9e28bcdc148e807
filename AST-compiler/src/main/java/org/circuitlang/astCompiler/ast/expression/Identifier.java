package org.circuitlang.astCompiler.ast.expression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

/** A name together with the place where it occurs. */
public final class Identifier extends Expression {
    public final String name;

    public Identifier(String name, Span span) {
        super(span);
        this.name = name;
    }

    @Override
    public Identifier reconstruct(ReconstructingDirector director) {
        return director.reduceIdentifier(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("name", this.name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return this.name.equals(that.name) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return 31 * this.name.hashCode() + this.span.hashCode();
    }
}
