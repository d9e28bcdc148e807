package org.circuitlang.astCompiler.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.util.ICastable;
import org.circuitlang.util.IHasId;
import org.circuitlang.util.IndentStreamBuilder;
import org.circuitlang.util.ToIndentableString;
import org.circuitlang.util.Utilities;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for all AST nodes.
 * Nodes are immutable; a compiler pass produces a new tree.
 * Equality is structural: the id is an allocation counter used only
 * for logging and never takes part in {@link #equals}.
 */
public abstract class AstNode implements ICastable, IHasId, ToIndentableString {
    static final AtomicLong crtId = new AtomicLong();
    public final long id;
    public final Span span;

    protected AstNode(Span span) {
        this.id = crtId.getAndIncrement();
        this.span = span;
    }

    public Span getSpan() {
        return this.span;
    }

    @Override
    public long getId() {
        return this.id;
    }

    /** Produces a JSON object with the class name, the span (when known),
     * and the fields written by {@link #fieldsAsJson}. */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("class", this.getClass().getSimpleName());
        if (this.span.isKnown())
            result.set("span", this.span.toJson(mapper));
        this.fieldsAsJson(result, mapper);
        return result;
    }

    public JsonNode toJson() {
        return this.toJson(Utilities.deterministicObjectMapper());
    }

    protected abstract void fieldsAsJson(ObjectNode result, ObjectMapper mapper);

    protected static ArrayNode listToJson(Collection<? extends AstNode> nodes, ObjectMapper mapper) {
        ArrayNode result = mapper.createArrayNode();
        for (AstNode node: nodes)
            result.add(node.toJson(mapper));
        return result;
    }

    protected static JsonNode nullableToJson(@Nullable AstNode node, ObjectMapper mapper) {
        if (node == null)
            return NullNode.getInstance();
        return node.toJson(mapper);
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        this.toString(builder);
        return builder.toString();
    }
}
