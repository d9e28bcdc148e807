package org.circuitlang.astCompiler.ast.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

/** Types without components. */
public final class TypePrimitive extends Type {
    public enum Kind {
        ADDRESS("address"),
        BOOLEAN("bool"),
        CHAR("char"),
        FIELD("field"),
        GROUP("group"),
        SELF_TYPE("Self"),
        /** Placeholder produced when type inference fails. */
        ERR("error");

        public final String text;

        Kind(String text) {
            this.text = text;
        }
    }

    public final Kind kind;

    public TypePrimitive(Kind kind) {
        this.kind = kind;
    }

    @Override
    public Type reconstruct(ReconstructingDirector director, Span span) {
        return director.reduceTypePrimitive(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("kind", this.kind.name());
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.kind.text);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return this.kind == ((TypePrimitive) o).kind;
    }

    @Override
    public int hashCode() {
        return this.kind.hashCode();
    }
}
