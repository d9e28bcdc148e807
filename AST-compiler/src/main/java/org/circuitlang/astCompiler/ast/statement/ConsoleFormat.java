package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** console.log(...) or console.error(...); its span is the span of the arguments. */
public final class ConsoleFormat extends ConsoleFunction {
    public enum Kind {
        ERROR("error"),
        LOG("log");

        public final String text;

        Kind(String text) {
            this.text = text;
        }
    }

    public final Kind kind;
    public final ConsoleArgs args;

    public ConsoleFormat(Kind kind, ConsoleArgs args) {
        super(args.span);
        this.kind = kind;
        this.args = args;
    }

    @Override
    public ConsoleFunction reconstruct(ReconstructingDirector director) {
        return director.reduceConsoleFormat(this);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("kind", this.kind.name());
        result.set("args", this.args.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.kind.text)
                .append("(")
                .append(this.args)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ConsoleFormat that = (ConsoleFormat) o;
        return this.kind == that.kind && this.args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.args);
    }
}
