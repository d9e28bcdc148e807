package org.circuitlang.astCompiler.ast.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

/** A type referred to by name: a circuit or an alias. */
public final class TypeIdentifier extends Type {
    public final Identifier identifier;

    public TypeIdentifier(Identifier identifier) {
        this.identifier = identifier;
    }

    @Override
    public Type reconstruct(ReconstructingDirector director, Span span) {
        return director.reduceTypeIdentifier(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("identifier", this.identifier.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.identifier);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.identifier.equals(((TypeIdentifier) o).identifier);
    }

    @Override
    public int hashCode() {
        return this.identifier.hashCode();
    }
}
