package org.circuitlang.astCompiler.compiler.reducer;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.ArrayAccess;
import org.circuitlang.astCompiler.ast.expression.ArrayInitExpression;
import org.circuitlang.astCompiler.ast.expression.ArrayInlineExpression;
import org.circuitlang.astCompiler.ast.expression.ArrayRangeAccess;
import org.circuitlang.astCompiler.ast.expression.BinaryExpression;
import org.circuitlang.astCompiler.ast.expression.CallExpression;
import org.circuitlang.astCompiler.ast.expression.CastExpression;
import org.circuitlang.astCompiler.ast.expression.CircuitInitExpression;
import org.circuitlang.astCompiler.ast.expression.CircuitVariableInitializer;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.expression.MemberAccess;
import org.circuitlang.astCompiler.ast.expression.SpreadOrExpression;
import org.circuitlang.astCompiler.ast.expression.StaticAccess;
import org.circuitlang.astCompiler.ast.expression.TernaryExpression;
import org.circuitlang.astCompiler.ast.expression.TupleAccess;
import org.circuitlang.astCompiler.ast.expression.TupleInitExpression;
import org.circuitlang.astCompiler.ast.expression.UnaryExpression;
import org.circuitlang.astCompiler.ast.expression.literal.GroupLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.GroupTuple;
import org.circuitlang.astCompiler.ast.expression.literal.GroupValue;
import org.circuitlang.astCompiler.ast.expression.literal.GroupValueSingle;
import org.circuitlang.astCompiler.ast.expression.literal.StringLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.ValueExpression;
import org.circuitlang.astCompiler.ast.program.Alias;
import org.circuitlang.astCompiler.ast.program.Annotation;
import org.circuitlang.astCompiler.ast.program.Circuit;
import org.circuitlang.astCompiler.ast.program.CircuitMember;
import org.circuitlang.astCompiler.ast.program.Function;
import org.circuitlang.astCompiler.ast.program.FunctionInput;
import org.circuitlang.astCompiler.ast.program.FunctionInputVariable;
import org.circuitlang.astCompiler.ast.program.ImportStatement;
import org.circuitlang.astCompiler.ast.program.ImportTree;
import org.circuitlang.astCompiler.ast.program.Program;
import org.circuitlang.astCompiler.ast.program.SelfKeyword;
import org.circuitlang.astCompiler.ast.statement.AssignStatement;
import org.circuitlang.astCompiler.ast.statement.Assignee;
import org.circuitlang.astCompiler.ast.statement.AssigneeAccess;
import org.circuitlang.astCompiler.ast.statement.Block;
import org.circuitlang.astCompiler.ast.statement.ConditionalStatement;
import org.circuitlang.astCompiler.ast.statement.ConsoleArgs;
import org.circuitlang.astCompiler.ast.statement.ConsoleAssert;
import org.circuitlang.astCompiler.ast.statement.ConsoleFormat;
import org.circuitlang.astCompiler.ast.statement.ConsoleFunction;
import org.circuitlang.astCompiler.ast.statement.ConsoleStatement;
import org.circuitlang.astCompiler.ast.statement.DefinitionStatement;
import org.circuitlang.astCompiler.ast.statement.ExpressionStatement;
import org.circuitlang.astCompiler.ast.statement.IterationStatement;
import org.circuitlang.astCompiler.ast.statement.ReturnStatement;
import org.circuitlang.astCompiler.ast.statement.Statement;
import org.circuitlang.astCompiler.ast.statement.VariableName;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.ast.type.TypeArray;
import org.circuitlang.astCompiler.ast.type.TypeIdentifier;
import org.circuitlang.astCompiler.ast.type.TypeInteger;
import org.circuitlang.astCompiler.ast.type.TypePrimitive;
import org.circuitlang.astCompiler.ast.type.TypeTuple;
import org.circuitlang.astCompiler.compiler.AstCompiler;
import org.circuitlang.astCompiler.compiler.CompilerOptions;
import org.circuitlang.astCompiler.compiler.errors.CompilationError;
import org.circuitlang.util.IWritesLogs;
import org.circuitlang.util.Linq;
import org.circuitlang.util.Logger;
import org.circuitlang.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a {@link ReconstructingReducer} over a program.
 * The tree is traversed in post-order: the children of a node are reduced
 * left to right, in the order in which they are declared, and then the
 * reducer hook for the node is called with the original node and the
 * reduced children.  The first exception thrown by a hook aborts the
 * whole traversal; no partial result is produced.
 *
 * <p>Every node kind has a method here.  The abstract node families
 * ({@link Expression}, {@link Statement}, {@link Type}, ...) dispatch to
 * them through their reconstruct methods.
 */
public class ReconstructingDirector implements IWritesLogs {
    protected final AstCompiler compiler;
    protected final ReconstructingReducer reducer;
    /** Names of the programs currently being reduced, outermost first. */
    protected final List<String> importStack;
    protected final boolean logChanges;

    public ReconstructingDirector(AstCompiler compiler, ReconstructingReducer reducer) {
        this.compiler = compiler;
        this.reducer = reducer;
        this.importStack = new ArrayList<>();
        this.logChanges = Logger.INSTANCE.getLoggingLevel(reducer.getClass()) >= 1;
    }

    /** Reduce a program with default compiler options. */
    public static Program reduce(Program program, ReconstructingReducer reducer) {
        AstCompiler compiler = new AstCompiler(new CompilerOptions());
        return new ReconstructingDirector(compiler, reducer).apply(program);
    }

    public ReconstructingReducer getReducer() {
        return this.reducer;
    }

    /** Reduce a whole program. */
    public Program apply(Program program) {
        Logger.INSTANCE.belowLevel(this.reducer.getClass(), 2)
                .append("Reducing program ")
                .append(program.name)
                .append(" with ")
                .appendSupplier(this.reducer::toString)
                .newline();
        this.importStack.clear();
        return this.reduceProgram(program);
    }

    /** Log the nodes that a reducer has changed. */
    protected <T extends AstNode> T map(AstNode original, T result) {
        if (this.logChanges && original != result && !original.equals(result)) {
            Logger.INSTANCE.belowLevel(this.reducer.getClass(), 1)
                    .appendSupplier(this.reducer::toString)
                    .append(": ")
                    .appendSupplier(original::toString)
                    .append(" -> ")
                    .appendSupplier(result::toString)
                    .newline();
        }
        return result;
    }

    //////////////////////// Types

    public Type reduceType(Type type, Span span) {
        Type newType = type.reconstruct(this, span);
        return this.map(type, this.reducer.reduceType(type, newType, span));
    }

    @Nullable
    public Type reduceNullableType(@Nullable Type type, Span span) {
        if (type == null)
            return null;
        return this.reduceType(type, span);
    }

    public Type reduceTypePrimitive(TypePrimitive type) {
        return type;
    }

    public Type reduceTypeInteger(TypeInteger type) {
        return type;
    }

    public Type reduceTypeArray(TypeArray type, Span span) {
        Type elementType = this.reduceType(type.elementType, span);
        return new TypeArray(elementType, type.dimensions);
    }

    public Type reduceTypeTuple(TypeTuple type, Span span) {
        List<Type> elements = new ArrayList<>(type.elements.size());
        for (Type element: type.elements)
            elements.add(this.reduceType(element, span));
        return new TypeTuple(elements);
    }

    public Type reduceTypeIdentifier(TypeIdentifier type) {
        return new TypeIdentifier(this.reduceIdentifier(type.identifier));
    }

    //////////////////////// Expressions

    public Expression reduceExpression(Expression expression) {
        Expression newExpression = expression.reconstruct(this);
        return this.map(expression, this.reducer.reduceExpression(expression, newExpression));
    }

    @Nullable
    public Expression reduceNullableExpression(@Nullable Expression expression) {
        if (expression == null)
            return null;
        return this.reduceExpression(expression);
    }

    public List<Expression> reduceExpressions(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression expression: expressions)
            result.add(this.reduceExpression(expression));
        return result;
    }

    public Identifier reduceIdentifier(Identifier identifier) {
        return this.reducer.reduceIdentifier(identifier);
    }

    public GroupValue reduceGroupTuple(GroupTuple groupTuple) {
        return this.reducer.reduceGroupTuple(groupTuple);
    }

    public GroupValue reduceGroupValueSingle(GroupValueSingle value) {
        return value;
    }

    public GroupValue reduceGroupValue(GroupValue groupValue) {
        GroupValue newValue = groupValue.reconstruct(this);
        return this.reducer.reduceGroupValue(groupValue, newValue);
    }

    public Expression reduceString(StringLiteral string) {
        return this.reducer.reduceString(string.characters, string.span);
    }

    public Expression reduceValue(ValueExpression value) {
        Expression newValue = value.reconstructValue(this);
        return this.reducer.reduceValue(value, newValue);
    }

    /** Literals without reducible components are kept. */
    public Expression reduceLiteral(ValueExpression value) {
        return value;
    }

    public Expression reduceGroupLiteral(GroupLiteral group) {
        return new GroupLiteral(this.reduceGroupValue(group.value));
    }

    public Expression reduceBinary(BinaryExpression binary) {
        Expression left = this.reduceExpression(binary.left);
        Expression right = this.reduceExpression(binary.right);
        return this.reducer.reduceBinary(binary, left, right, binary.operation);
    }

    public Expression reduceUnary(UnaryExpression unary) {
        Expression inner = this.reduceExpression(unary.inner);
        return this.reducer.reduceUnary(unary, inner, unary.operation);
    }

    public Expression reduceTernary(TernaryExpression ternary) {
        Expression condition = this.reduceExpression(ternary.condition);
        Expression ifTrue = this.reduceExpression(ternary.ifTrue);
        Expression ifFalse = this.reduceExpression(ternary.ifFalse);
        return this.reducer.reduceTernary(ternary, condition, ifTrue, ifFalse);
    }

    public Expression reduceCast(CastExpression cast) {
        Expression inner = this.reduceExpression(cast.inner);
        Type targetType = this.reduceType(cast.targetType, cast.span);
        return this.reducer.reduceCast(cast, inner, targetType);
    }

    public ArrayAccess reduceArrayAccess(ArrayAccess access) {
        Expression array = this.reduceExpression(access.array);
        Expression index = this.reduceExpression(access.index);
        return this.reducer.reduceArrayAccess(access, array, index);
    }

    public ArrayRangeAccess reduceArrayRangeAccess(ArrayRangeAccess access) {
        Expression array = this.reduceExpression(access.array);
        Expression left = this.reduceNullableExpression(access.left);
        Expression right = this.reduceNullableExpression(access.right);
        return this.reducer.reduceArrayRangeAccess(access, array, left, right);
    }

    public MemberAccess reduceMemberAccess(MemberAccess access) {
        Expression inner = this.reduceExpression(access.inner);
        Identifier name = this.reduceIdentifier(access.name);
        Type type = this.reduceNullableType(access.type, access.span);
        return this.reducer.reduceMemberAccess(access, inner, name, type);
    }

    public TupleAccess reduceTupleAccess(TupleAccess access) {
        Expression tuple = this.reduceExpression(access.tuple);
        return this.reducer.reduceTupleAccess(access, tuple);
    }

    public StaticAccess reduceStaticAccess(StaticAccess access) {
        Expression value = this.reduceExpression(access.inner);
        Type type = this.reduceNullableType(access.type.get(), access.span);
        Identifier name = this.reduceIdentifier(access.name);
        return this.reducer.reduceStaticAccess(access, value, type, name);
    }

    public SpreadOrExpression reduceSpreadOrExpression(SpreadOrExpression element) {
        return new SpreadOrExpression(element.spread, this.reduceExpression(element.expression));
    }

    public Expression reduceArrayInline(ArrayInlineExpression array) {
        List<SpreadOrExpression> elements = Linq.map(array.elements, this::reduceSpreadOrExpression);
        return this.reducer.reduceArrayInline(array, elements);
    }

    public Expression reduceArrayInit(ArrayInitExpression array) {
        Expression element = this.reduceExpression(array.element);
        return this.reducer.reduceArrayInit(array, element);
    }

    public Expression reduceTupleInit(TupleInitExpression tuple) {
        List<Expression> elements = this.reduceExpressions(tuple.elements);
        return this.reducer.reduceTupleInit(tuple, elements);
    }

    public CircuitVariableInitializer reduceCircuitVariableInitializer(CircuitVariableInitializer variable) {
        Identifier identifier = this.reduceIdentifier(variable.identifier);
        Expression expression = this.reduceNullableExpression(variable.expression);
        return this.reducer.reduceCircuitVariableInitializer(variable, identifier, expression);
    }

    public Expression reduceCircuitInit(CircuitInitExpression circuitInit) {
        Identifier name = this.reduceIdentifier(circuitInit.name);
        List<CircuitVariableInitializer> members =
                Linq.map(circuitInit.members, this::reduceCircuitVariableInitializer);
        return this.reducer.reduceCircuitInit(circuitInit, name, members);
    }

    public Expression reduceCall(CallExpression call) {
        Expression function = this.reduceExpression(call.function);
        List<Expression> arguments = this.reduceExpressions(call.arguments);
        return this.reducer.reduceCall(call, function, arguments);
    }

    //////////////////////// Statements

    public Statement reduceStatement(Statement statement) {
        Statement newStatement = statement.reconstruct(this);
        return this.map(statement, this.reducer.reduceStatement(statement, newStatement));
    }

    public Statement reduceReturn(ReturnStatement statement) {
        Expression expression = this.reduceExpression(statement.expression);
        return this.reducer.reduceReturn(statement, expression);
    }

    public VariableName reduceVariableName(VariableName variableName) {
        Identifier identifier = this.reduceIdentifier(variableName.identifier);
        return this.reducer.reduceVariableName(variableName, identifier);
    }

    public DefinitionStatement reduceDefinition(DefinitionStatement definition) {
        List<VariableName> variableNames = Linq.map(definition.variableNames, this::reduceVariableName);
        Type type = this.reduceType(definition.type, definition.span);
        Expression value = this.reduceExpression(definition.value);
        return this.reducer.reduceDefinition(definition, variableNames, type, value);
    }

    public AssigneeAccess reduceAssigneeAccess(AssigneeAccess access) {
        AssigneeAccess newAccess = access.reconstruct(this);
        return this.reducer.reduceAssigneeAccess(access, newAccess);
    }

    public AssigneeAccess reduceAssigneeArrayRange(AssigneeAccess.ArrayRange range) {
        Expression left = this.reduceNullableExpression(range.left);
        Expression right = this.reduceNullableExpression(range.right);
        return new AssigneeAccess.ArrayRange(left, right);
    }

    public AssigneeAccess reduceAssigneeArrayIndex(AssigneeAccess.ArrayIndex index) {
        return new AssigneeAccess.ArrayIndex(this.reduceExpression(index.index));
    }

    public AssigneeAccess reduceAssigneeTuple(AssigneeAccess.Tuple tuple) {
        return new AssigneeAccess.Tuple(tuple.index, tuple.span);
    }

    public AssigneeAccess reduceAssigneeMember(AssigneeAccess.Member member) {
        return new AssigneeAccess.Member(this.reduceIdentifier(member.name));
    }

    public Assignee reduceAssignee(Assignee assignee) {
        Identifier identifier = this.reduceIdentifier(assignee.identifier);
        List<AssigneeAccess> accesses = Linq.map(assignee.accesses, this::reduceAssigneeAccess);
        return this.reducer.reduceAssignee(assignee, identifier, accesses);
    }

    public Statement reduceAssign(AssignStatement assign) {
        Assignee assignee = this.reduceAssignee(assign.assignee);
        Expression value = this.reduceExpression(assign.value);
        return this.reducer.reduceAssign(assign, assignee, value);
    }

    public Statement reduceConditional(ConditionalStatement conditional) {
        Expression condition = this.reduceExpression(conditional.condition);
        Block block = this.reduceBlock(conditional.block);
        Statement next = null;
        if (conditional.next != null)
            next = this.reduceStatement(conditional.next);
        return this.reducer.reduceConditional(conditional, condition, block, next);
    }

    public Statement reduceIteration(IterationStatement iteration) {
        Identifier variable = this.reduceIdentifier(iteration.variable);
        Type type = this.reduceType(iteration.type, iteration.span);
        Expression start = this.reduceExpression(iteration.start);
        Expression stop = this.reduceExpression(iteration.stop);
        Block block = this.reduceBlock(iteration.block);
        return this.reducer.reduceIteration(iteration, variable, type, start, stop, block);
    }

    public ConsoleFunction reduceConsoleAssert(ConsoleAssert consoleAssert) {
        return new ConsoleAssert(this.reduceExpression(consoleAssert.expression));
    }

    public ConsoleFunction reduceConsoleFormat(ConsoleFormat format) {
        List<Expression> parameters = this.reduceExpressions(format.args.parameters);
        ConsoleArgs args = new ConsoleArgs(format.args.string, parameters, format.args.span);
        return new ConsoleFormat(format.kind, args);
    }

    public Statement reduceConsole(ConsoleStatement console) {
        ConsoleFunction function = console.function.reconstruct(this);
        return this.reducer.reduceConsole(console, function);
    }

    public Statement reduceExpressionStatement(ExpressionStatement statement) {
        Expression expression = this.reduceExpression(statement.expression);
        return this.reducer.reduceExpressionStatement(statement, expression);
    }

    public Block reduceBlock(Block block) {
        List<Statement> statements = new ArrayList<>(block.statements.size());
        for (Statement statement: block.statements)
            statements.add(this.reduceStatement(statement));
        return this.reducer.reduceBlock(block, statements);
    }

    //////////////////////// Programs

    public FunctionInput reduceFunctionInputVariable(FunctionInputVariable variable) {
        Identifier identifier = this.reduceIdentifier(variable.identifier);
        Type type = this.reduceType(variable.type, variable.span);
        return this.reducer.reduceFunctionInputVariable(variable, identifier, type);
    }

    public FunctionInput reduceSelfKeyword(SelfKeyword keyword) {
        return keyword;
    }

    public FunctionInput reduceFunctionInput(FunctionInput input) {
        FunctionInput newInput = input.reconstruct(this);
        return this.reducer.reduceFunctionInput(input, newInput);
    }

    public ImportTree reduceImportTree(ImportTree tree) {
        List<Identifier> base = Linq.map(tree.base, this::reduceIdentifier);
        Identifier alias = null;
        if (tree.alias != null)
            alias = this.reduceIdentifier(tree.alias);
        List<ImportTree> nested = Linq.map(tree.nested, this::reduceImportTree);
        ImportTree newTree = new ImportTree(base, tree.kind, alias, nested, tree.span);
        return this.reducer.reduceImportTree(tree, newTree);
    }

    public ImportStatement reduceImportStatement(ImportStatement statement) {
        ImportTree tree = this.reduceImportTree(statement.tree);
        return this.reducer.reduceImportStatement(statement, tree);
    }

    public CircuitMember reduceCircuitMember(CircuitMember member) {
        CircuitMember newMember = member.reconstruct(this);
        return this.reducer.reduceCircuitMember(member, newMember);
    }

    public CircuitMember reduceCircuitConst(CircuitMember.CircuitConst member) {
        Identifier name = this.reduceIdentifier(member.name);
        Type type = this.reduceType(member.type, member.span);
        Expression value = this.reduceExpression(member.value);
        return new CircuitMember.CircuitConst(name, type, value);
    }

    public CircuitMember reduceCircuitVariable(CircuitMember.CircuitVariable member) {
        Identifier name = this.reduceIdentifier(member.name);
        Type type = this.reduceType(member.type, member.span);
        return new CircuitMember.CircuitVariable(name, type);
    }

    public CircuitMember reduceCircuitFunction(CircuitMember.CircuitFunction member) {
        return new CircuitMember.CircuitFunction(this.reduceFunction(member.function));
    }

    public Circuit reduceCircuit(Circuit circuit) {
        Identifier name = this.reduceIdentifier(circuit.circuitName);
        List<CircuitMember> members = Linq.map(circuit.members, this::reduceCircuitMember);
        return this.reducer.reduceCircuit(circuit, name, members);
    }

    public Alias reduceAlias(Alias alias) {
        Identifier name = this.reduceIdentifier(alias.name);
        Type represents = this.reduceType(alias.represents, alias.span);
        return this.reducer.reduceAlias(alias, name, represents);
    }

    public Annotation reduceAnnotation(Annotation annotation) {
        Identifier name = this.reduceIdentifier(annotation.name);
        return this.reducer.reduceAnnotation(annotation, name);
    }

    public Function reduceFunction(Function function) {
        Identifier identifier = this.reduceIdentifier(function.identifier);
        Map<String, Annotation> annotations = new LinkedHashMap<>();
        for (Map.Entry<String, Annotation> entry: function.annotations.entrySet())
            annotations.put(entry.getKey(), this.reduceAnnotation(entry.getValue()));
        List<FunctionInput> inputs = Linq.map(function.inputs, this::reduceFunctionInput);
        Type output = this.reduceType(function.output, function.span);
        Block block = this.reduceBlock(function.block);
        return this.map(function, this.reducer.reduceFunction(
                function, identifier, annotations, inputs, function.isConst, output, block));
    }

    /** Fails if the program is already being reduced further up the import chain. */
    protected void checkImportCycle(Program program) {
        if (!this.importStack.contains(program.name))
            return;
        List<String> cycle = new ArrayList<>(
                this.importStack.subList(this.importStack.indexOf(program.name), this.importStack.size()));
        cycle.add(program.name);
        throw new CompilationError("Import cycle: " + String.join(" -> ", cycle));
    }

    /** Reduce a program and, recursively, all the programs it imports.
     * Table keys are copied, not reduced. */
    public Program reduceProgram(Program program) {
        boolean checkCycles = this.compiler.options.reductionOptions.checkImportCycles;
        if (checkCycles)
            this.checkImportCycle(program);
        this.importStack.add(program.name);
        try {
            List<FunctionInput> expectedInput = Linq.map(program.expectedInput, this::reduceFunctionInput);
            List<ImportStatement> importStatements =
                    Linq.map(program.importStatements, this::reduceImportStatement);

            Map<List<String>, Program> imports = new LinkedHashMap<>();
            for (Map.Entry<List<String>, Program> entry: program.imports.entrySet()) {
                Program imported = this.reduceProgram(entry.getValue());
                Map.Entry<List<String>, Program> reduced =
                        this.reducer.reduceImport(List.copyOf(entry.getKey()), imported);
                Utilities.putNew(imports, reduced.getKey(), reduced.getValue());
            }

            Map<Identifier, Alias> aliases = new LinkedHashMap<>();
            for (Map.Entry<Identifier, Alias> entry: program.aliases.entrySet())
                aliases.put(entry.getKey(), this.reduceAlias(entry.getValue()));

            Map<Identifier, Circuit> circuits = new LinkedHashMap<>();
            try (CircuitScope ignored = this.reducer.enterCircuit()) {
                for (Map.Entry<Identifier, Circuit> entry: program.circuits.entrySet())
                    circuits.put(entry.getKey(), this.reduceCircuit(entry.getValue()));
            }

            Map<Identifier, Function> functions = new LinkedHashMap<>();
            for (Map.Entry<Identifier, Function> entry: program.functions.entrySet())
                functions.put(entry.getKey(), this.reduceFunction(entry.getValue()));

            Map<List<Identifier>, DefinitionStatement> globalConsts = new LinkedHashMap<>();
            for (Map.Entry<List<Identifier>, DefinitionStatement> entry: program.globalConsts.entrySet())
                globalConsts.put(List.copyOf(entry.getKey()), this.reduceDefinition(entry.getValue()));

            return this.reducer.reduceProgram(program, expectedInput, importStatements, imports,
                    aliases, circuits, functions, globalConsts);
        } finally {
            Utilities.removeLast(this.importStack);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "(" + this.reducer + ")";
    }
}
