package org.circuitlang.astCompiler.ast.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;
import org.circuitlang.util.Linq;

import java.util.List;

public final class TypeTuple extends Type {
    public final List<Type> elements;

    public TypeTuple(List<Type> elements) {
        this.elements = List.copyOf(elements);
    }

    public TypeTuple(Type... elements) {
        this(Linq.list(elements));
    }

    @Override
    public Type reconstruct(ReconstructingDirector director, Span span) {
        return director.reduceTypeTuple(this, span);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("elements", listToJson(this.elements, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .joinI(", ", this.elements)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.elements.equals(((TypeTuple) o).elements);
    }

    @Override
    public int hashCode() {
        return this.elements.hashCode();
    }
}
