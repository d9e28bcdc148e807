package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.util.IIndentStream;
import org.circuitlang.util.Linq;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * The path of an import statement.  A tree is a base path followed by
 * a glob (base.*), a leaf that may be renamed (base.name as alias), or a
 * nested list of trees (base.(a, b.c)).
 */
public final class ImportTree extends AstNode {
    public enum Kind {
        GLOB,
        LEAF,
        NESTED
    }

    public final List<Identifier> base;
    public final Kind kind;
    /** Only for {@link Kind#LEAF}. */
    @Nullable
    public final Identifier alias;
    /** Empty unless the kind is {@link Kind#NESTED}. */
    public final List<ImportTree> nested;

    public ImportTree(List<Identifier> base, Kind kind, @Nullable Identifier alias,
                      List<ImportTree> nested, Span span) {
        super(span);
        this.base = List.copyOf(base);
        this.kind = kind;
        this.alias = alias;
        this.nested = List.copyOf(nested);
    }

    public static ImportTree glob(List<Identifier> base, Span span) {
        return new ImportTree(base, Kind.GLOB, null, List.of(), span);
    }

    public static ImportTree leaf(List<Identifier> base, @Nullable Identifier alias, Span span) {
        return new ImportTree(base, Kind.LEAF, alias, List.of(), span);
    }

    public static ImportTree nested(List<Identifier> base, List<ImportTree> nested, Span span) {
        return new ImportTree(base, Kind.NESTED, null, nested, span);
    }

    /** The base path as plain names. */
    public List<String> getPath() {
        return Linq.map(this.base, i -> i.name);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("base", listToJson(this.base, mapper));
        result.put("kind", this.kind.name());
        if (this.alias != null)
            result.set("alias", this.alias.toJson(mapper));
        if (this.kind == Kind.NESTED)
            result.set("nested", listToJson(this.nested, mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.joinI(".", this.base);
        switch (this.kind) {
            case GLOB:
                builder.append(".*");
                break;
            case LEAF:
                if (this.alias != null)
                    builder.append(" as ").append(this.alias);
                break;
            case NESTED:
                builder.append(".(")
                        .joinI(", ", this.nested)
                        .append(")");
                break;
        }
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ImportTree that = (ImportTree) o;
        return this.base.equals(that.base) &&
                this.kind == that.kind &&
                Objects.equals(this.alias, that.alias) &&
                this.nested.equals(that.nested) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.base, this.kind, this.alias, this.nested, this.span);
    }
}
