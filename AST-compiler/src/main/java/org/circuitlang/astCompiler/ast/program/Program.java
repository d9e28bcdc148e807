package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.statement.DefinitionStatement;
import org.circuitlang.util.IIndentStream;
import org.circuitlang.util.Linq;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The root of the AST: one source file together with the programs it imports.
 * All tables keep their insertion order.
 * The imported programs are the only place where the tree is not a strict
 * ownership tree: the same program may be imported from several places.
 */
public final class Program extends AstNode {
    public final String name;
    public final List<FunctionInput> expectedInput;
    public final List<ImportStatement> importStatements;
    /** Resolved imports, keyed by their qualified path. */
    public final Map<List<String>, Program> imports;
    public final Map<Identifier, Alias> aliases;
    public final Map<Identifier, Circuit> circuits;
    public final Map<Identifier, Function> functions;
    /** Keyed by the names introduced by each definition. */
    public final Map<List<Identifier>, DefinitionStatement> globalConsts;

    public Program(String name,
                   List<FunctionInput> expectedInput,
                   List<ImportStatement> importStatements,
                   Map<List<String>, Program> imports,
                   Map<Identifier, Alias> aliases,
                   Map<Identifier, Circuit> circuits,
                   Map<Identifier, Function> functions,
                   Map<List<Identifier>, DefinitionStatement> globalConsts) {
        super(Span.NONE);
        this.name = name;
        this.expectedInput = List.copyOf(expectedInput);
        this.importStatements = List.copyOf(importStatements);
        this.imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        this.circuits = Collections.unmodifiableMap(new LinkedHashMap<>(circuits));
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.globalConsts = Collections.unmodifiableMap(new LinkedHashMap<>(globalConsts));
    }

    /** An empty program. */
    public Program(String name) {
        this(name, List.of(), List.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    /** Find a function by name; null if there is none. */
    @Nullable
    public Function getFunction(String name) {
        for (Map.Entry<Identifier, Function> entry: this.functions.entrySet())
            if (entry.getKey().name.equals(name))
                return entry.getValue();
        return null;
    }

    /** Find a circuit by name; null if there is none. */
    @Nullable
    public Circuit getCircuit(String name) {
        for (Map.Entry<Identifier, Circuit> entry: this.circuits.entrySet())
            if (entry.getKey().name.equals(name))
                return entry.getValue();
        return null;
    }

    /** A copy of this program with a different function table. */
    public Program withFunctions(Map<Identifier, Function> functions) {
        return new Program(this.name, this.expectedInput, this.importStatements, this.imports,
                this.aliases, this.circuits, functions, this.globalConsts);
    }

    @Override
    protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
        result.put("name", this.name);
        result.set("expectedInput", listToJson(this.expectedInput, mapper));
        result.set("importStatements", listToJson(this.importStatements, mapper));
        ObjectNode imports = result.putObject("imports");
        for (Map.Entry<List<String>, Program> entry: this.imports.entrySet())
            imports.set(String.join(".", entry.getKey()), entry.getValue().toJson(mapper));
        ObjectNode aliases = result.putObject("aliases");
        for (Map.Entry<Identifier, Alias> entry: this.aliases.entrySet())
            aliases.set(entry.getKey().name, entry.getValue().toJson(mapper));
        ObjectNode circuits = result.putObject("circuits");
        for (Map.Entry<Identifier, Circuit> entry: this.circuits.entrySet())
            circuits.set(entry.getKey().name, entry.getValue().toJson(mapper));
        ObjectNode functions = result.putObject("functions");
        for (Map.Entry<Identifier, Function> entry: this.functions.entrySet())
            functions.set(entry.getKey().name, entry.getValue().toJson(mapper));
        ObjectNode globalConsts = result.putObject("globalConsts");
        for (Map.Entry<List<Identifier>, DefinitionStatement> entry: this.globalConsts.entrySet())
            globalConsts.set(String.join(",", Linq.map(entry.getKey(), i -> i.name)),
                    entry.getValue().toJson(mapper));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("// program ").append(this.name).newline();
        for (ImportStatement statement: this.importStatements)
            builder.append(statement).newline();
        for (Alias alias: this.aliases.values())
            builder.append(alias).newline();
        for (DefinitionStatement definition: this.globalConsts.values())
            builder.append(definition).newline();
        for (Circuit circuit: this.circuits.values())
            builder.append(circuit).newline();
        for (Function function: this.functions.values())
            builder.append(function).newline();
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Program that = (Program) o;
        return this.name.equals(that.name) &&
                this.expectedInput.equals(that.expectedInput) &&
                this.importStatements.equals(that.importStatements) &&
                this.imports.equals(that.imports) &&
                this.aliases.equals(that.aliases) &&
                this.circuits.equals(that.circuits) &&
                this.functions.equals(that.functions) &&
                this.globalConsts.equals(that.globalConsts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.expectedInput, this.importStatements, this.imports,
                this.aliases, this.circuits, this.functions, this.globalConsts);
    }
}
