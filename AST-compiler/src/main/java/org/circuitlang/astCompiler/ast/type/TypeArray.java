package org.circuitlang.astCompiler.ast.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.ArrayDimensions;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** Array type; the dimensions may be left for inference. */
public final class TypeArray extends Type {
    public final Type elementType;
    @Nullable
    public final ArrayDimensions dimensions;

    public TypeArray(Type elementType, @Nullable ArrayDimensions dimensions) {
        this.elementType = elementType;
        this.dimensions = dimensions;
    }

    @Override
    public Type reconstruct(ReconstructingDirector director, Span span) {
        return director.reduceTypeArray(this, span);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("elementType", this.elementType.toJson(mapper));
        if (this.dimensions != null)
            result.set("dimensions", this.dimensions.toJson(mapper));
        else
            result.putNull("dimensions");
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("[")
                .append(this.elementType)
                .append("; ")
                .append(this.dimensions == null ? "_" : this.dimensions.toString())
                .append("]");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        TypeArray that = (TypeArray) o;
        return this.elementType.equals(that.elementType) &&
                Objects.equals(this.dimensions, that.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.elementType, this.dimensions);
    }
}
