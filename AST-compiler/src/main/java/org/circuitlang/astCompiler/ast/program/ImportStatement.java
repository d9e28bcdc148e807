package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

public final class ImportStatement extends AstNode {
    public final ImportTree tree;

    public ImportStatement(ImportTree tree, Span span) {
        super(span);
        this.tree = tree;
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("tree", this.tree.toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("import ")
                .append(this.tree)
                .append(";");
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ImportStatement that = (ImportStatement) o;
        return this.tree.equals(that.tree) && this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.tree, this.span);
    }
}
