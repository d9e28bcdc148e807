package org.circuitlang.astCompiler.ast.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

public final class TypeInteger extends Type {
    public final IntegerType integerType;

    public TypeInteger(IntegerType integerType) {
        this.integerType = integerType;
    }

    @Override
    public Type reconstruct(ReconstructingDirector director, Span span) {
        return director.reduceTypeInteger(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("integerType", this.integerType.name());
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.integerType.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.integerType == ((TypeInteger) o).integerType;
    }

    @Override
    public int hashCode() {
        return this.integerType.hashCode();
    }
}
