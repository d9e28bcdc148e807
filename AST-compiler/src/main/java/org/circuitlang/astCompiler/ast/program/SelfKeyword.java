package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** self, const self or mut self as the first input of a circuit function. */
public final class SelfKeyword extends FunctionInput {
    public enum Kind {
        SELF("self"),
        CONST_SELF("const self"),
        MUT_SELF("mut self");

        public final String text;

        Kind(String text) {
            this.text = text;
        }
    }

    public final Kind kind;

    public SelfKeyword(Kind kind, Span span) {
        super(span);
        this.kind = kind;
    }

    @Override
    public FunctionInput reconstruct(ReconstructingDirector director) {
        return director.reduceSelfKeyword(this);
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
        SelfKeyword that = (SelfKeyword) o;
        return this.kind == that.kind && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.span);
    }
}
