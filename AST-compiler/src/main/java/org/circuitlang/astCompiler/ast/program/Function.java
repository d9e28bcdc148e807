package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.statement.Block;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.util.Cell;
import org.circuitlang.util.IIndentStream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function declaration.
 * Annotations are keyed by their name.  The core mapping names the
 * built-in implementation a backend should use for this function, and
 * may be filled in after the function is built.
 */
public final class Function extends AstNode {
    public final Identifier identifier;
    public final Map<String, Annotation> annotations;
    public final List<FunctionInput> inputs;
    public final boolean isConst;
    public final Type output;
    public final Block block;
    public final Cell<String> coreMapping;

    public Function(Identifier identifier, Map<String, Annotation> annotations, List<FunctionInput> inputs,
                    boolean isConst, Type output, Block block, Cell<String> coreMapping, Span span) {
        super(span);
        this.identifier = identifier;
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.inputs = List.copyOf(inputs);
        this.isConst = isConst;
        this.output = output;
        this.block = block;
        this.coreMapping = coreMapping;
    }

    public String getName() {
        return this.identifier.name;
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.set("identifier", this.identifier.toJson(mapper));
        ObjectNode annotations = result.putObject("annotations");
        for (Map.Entry<String, Annotation> entry: this.annotations.entrySet())
            annotations.set(entry.getKey(), entry.getValue().toJson(mapper));
        result.set("inputs", listToJson(this.inputs, mapper));
        result.put("isConst", this.isConst);
        result.set("output", this.output.toJson(mapper));
        result.set("block", this.block.toJson(mapper));
        String coreMapping = this.coreMapping.get();
        if (coreMapping != null)
            result.put("coreMapping", coreMapping);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        for (Annotation annotation: this.annotations.values())
            builder.append(annotation).newline();
        if (this.isConst)
            builder.append("const ");
        return builder.append("function ")
                .append(this.identifier)
                .append("(")
                .joinI(", ", this.inputs)
                .append(") -> ")
                .append(this.output)
                .append(" ")
                .append(this.block);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Function that = (Function) o;
        return this.identifier.equals(that.identifier) &&
                this.annotations.equals(that.annotations) &&
                this.inputs.equals(that.inputs) &&
                this.isConst == that.isConst &&
                this.output.equals(that.output) &&
                this.block.equals(that.block) &&
                this.coreMapping.equals(that.coreMapping) &&
                this.span.equals(that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.identifier, this.annotations, this.inputs, this.isConst,
                this.output, this.block, this.span);
    }
}
