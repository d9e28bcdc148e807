package org.circuitlang.astCompiler.compiler.reducer;

import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.ArrayAccess;
import org.circuitlang.astCompiler.ast.expression.ArrayInitExpression;
import org.circuitlang.astCompiler.ast.expression.ArrayInlineExpression;
import org.circuitlang.astCompiler.ast.expression.ArrayRangeAccess;
import org.circuitlang.astCompiler.ast.expression.BinaryExpression;
import org.circuitlang.astCompiler.ast.expression.BinaryOperation;
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
import org.circuitlang.astCompiler.ast.expression.UnaryOperation;
import org.circuitlang.astCompiler.ast.expression.literal.Char;
import org.circuitlang.astCompiler.ast.expression.literal.GroupTuple;
import org.circuitlang.astCompiler.ast.expression.literal.GroupValue;
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
import org.circuitlang.astCompiler.ast.statement.AssignStatement;
import org.circuitlang.astCompiler.ast.statement.Assignee;
import org.circuitlang.astCompiler.ast.statement.AssigneeAccess;
import org.circuitlang.astCompiler.ast.statement.Block;
import org.circuitlang.astCompiler.ast.statement.ConditionalStatement;
import org.circuitlang.astCompiler.ast.statement.ConsoleFunction;
import org.circuitlang.astCompiler.ast.statement.ConsoleStatement;
import org.circuitlang.astCompiler.ast.statement.DefinitionStatement;
import org.circuitlang.astCompiler.ast.statement.ExpressionStatement;
import org.circuitlang.astCompiler.ast.statement.IterationStatement;
import org.circuitlang.astCompiler.ast.statement.ReturnStatement;
import org.circuitlang.astCompiler.ast.statement.Statement;
import org.circuitlang.astCompiler.ast.statement.VariableName;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.util.Cell;

import javax.annotation.Nullable;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites the AST bottom-up, one node kind at a time.
 *
 * <p>The {@link ReconstructingDirector} walks the tree in post-order; for every
 * node it first reduces the children and then calls the hook for the node kind
 * with the original node and the reduced children.  Each hook returns the node
 * that replaces the original.  The default implementations put the node back
 * together from the reduced children and copy all other fields (span, flags,
 * operators) from the original, so a reducer that overrides nothing rebuilds a
 * tree that is equal to its input.
 *
 * <p>Hooks signal failure by throwing a
 * {@link org.circuitlang.astCompiler.compiler.errors.CompilationError}; the
 * traversal stops at the first failure.  Hooks must not modify their inputs.
 *
 * <p>Hooks that take a "new" value (reduceType, reduceExpression, ...) are
 * called after a more specific hook has already produced the replacement;
 * they can inspect or replace any node of a whole family.
 */
@SuppressWarnings("unused")
public interface ReconstructingReducer {
    /** True while the circuit declarations of a program are being reduced. */
    boolean inCircuit();

    /** Flip the in-circuit flag. */
    void swapInCircuit();

    /** Set the in-circuit flag until the returned scope is closed. */
    default CircuitScope enterCircuit() {
        return new CircuitScope(this);
    }

    ////////////////////// Types

    /** @param span  Span of the node that contains the type. */
    default Type reduceType(Type type, Type newType, Span span) {
        return newType;
    }

    ////////////////////// Expressions

    default Expression reduceExpression(Expression expression, Expression newExpression) {
        return newExpression;
    }

    default Identifier reduceIdentifier(Identifier identifier) {
        return new Identifier(identifier.name, identifier.span);
    }

    default GroupTuple reduceGroupTuple(GroupTuple groupTuple) {
        return new GroupTuple(groupTuple.x, groupTuple.y, groupTuple.span);
    }

    default GroupValue reduceGroupValue(GroupValue groupValue, GroupValue newValue) {
        return newValue;
    }

    default Expression reduceString(List<Char> string, Span span) {
        return new StringLiteral(string, span);
    }

    default Expression reduceValue(ValueExpression value, Expression newValue) {
        return newValue;
    }

    default BinaryExpression reduceBinary(
            BinaryExpression binary, Expression left, Expression right, BinaryOperation operation) {
        return new BinaryExpression(left, right, operation, binary.span);
    }

    default UnaryExpression reduceUnary(UnaryExpression unary, Expression inner, UnaryOperation operation) {
        return new UnaryExpression(inner, operation, unary.span);
    }

    default TernaryExpression reduceTernary(
            TernaryExpression ternary, Expression condition, Expression ifTrue, Expression ifFalse) {
        return new TernaryExpression(condition, ifTrue, ifFalse, ternary.span);
    }

    default CastExpression reduceCast(CastExpression cast, Expression inner, Type targetType) {
        return new CastExpression(inner, targetType, cast.span);
    }

    default ArrayAccess reduceArrayAccess(ArrayAccess arrayAccess, Expression array, Expression index) {
        return new ArrayAccess(array, index, arrayAccess.span);
    }

    default ArrayRangeAccess reduceArrayRangeAccess(
            ArrayRangeAccess arrayRangeAccess, Expression array,
            @Nullable Expression left, @Nullable Expression right) {
        return new ArrayRangeAccess(array, left, right, arrayRangeAccess.span);
    }

    default MemberAccess reduceMemberAccess(
            MemberAccess memberAccess, Expression inner, Identifier name, @Nullable Type type) {
        return new MemberAccess(inner, name, type, memberAccess.span);
    }

    default TupleAccess reduceTupleAccess(TupleAccess tupleAccess, Expression tuple) {
        return new TupleAccess(tuple, tupleAccess.index, tupleAccess.span);
    }

    /** The result gets a fresh type cell, so setting the type of the
     * result does not affect the original. */
    default StaticAccess reduceStaticAccess(
            StaticAccess staticAccess, Expression value, @Nullable Type type, Identifier name) {
        return new StaticAccess(value, name, new Cell<>(type), staticAccess.span);
    }

    default ArrayInlineExpression reduceArrayInline(
            ArrayInlineExpression arrayInline, List<SpreadOrExpression> elements) {
        return new ArrayInlineExpression(elements, arrayInline.span);
    }

    default ArrayInitExpression reduceArrayInit(ArrayInitExpression arrayInit, Expression element) {
        return new ArrayInitExpression(element, arrayInit.dimensions, arrayInit.span);
    }

    default TupleInitExpression reduceTupleInit(TupleInitExpression tupleInit, List<Expression> elements) {
        return new TupleInitExpression(elements, tupleInit.span);
    }

    default CircuitVariableInitializer reduceCircuitVariableInitializer(
            CircuitVariableInitializer variable, Identifier identifier, @Nullable Expression expression) {
        return new CircuitVariableInitializer(identifier, expression);
    }

    default CircuitInitExpression reduceCircuitInit(
            CircuitInitExpression circuitInit, Identifier name, List<CircuitVariableInitializer> members) {
        return new CircuitInitExpression(name, members, circuitInit.span);
    }

    default CallExpression reduceCall(CallExpression call, Expression function, List<Expression> arguments) {
        return new CallExpression(function, arguments, call.span);
    }

    ////////////////////// Statements

    default Statement reduceStatement(Statement statement, Statement newStatement) {
        return newStatement;
    }

    default ReturnStatement reduceReturn(ReturnStatement returnStatement, Expression expression) {
        return new ReturnStatement(expression, returnStatement.span);
    }

    default VariableName reduceVariableName(VariableName variableName, Identifier identifier) {
        return new VariableName(variableName.mutable, identifier, variableName.span);
    }

    default DefinitionStatement reduceDefinition(
            DefinitionStatement definition, List<VariableName> variableNames, Type type, Expression value) {
        return new DefinitionStatement(definition.declarationType, variableNames,
                definition.parened, type, value, definition.span);
    }

    default AssigneeAccess reduceAssigneeAccess(AssigneeAccess access, AssigneeAccess newAccess) {
        return newAccess;
    }

    default Assignee reduceAssignee(Assignee assignee, Identifier identifier, List<AssigneeAccess> accesses) {
        return new Assignee(identifier, accesses, assignee.span);
    }

    default AssignStatement reduceAssign(AssignStatement assign, Assignee assignee, Expression value) {
        return new AssignStatement(assign.operation, assignee, value, assign.span);
    }

    default ConditionalStatement reduceConditional(
            ConditionalStatement conditional, Expression condition, Block block, @Nullable Statement next) {
        return new ConditionalStatement(condition, block, next, conditional.span);
    }

    default IterationStatement reduceIteration(
            IterationStatement iteration, Identifier variable, Type type,
            Expression start, Expression stop, Block block) {
        return new IterationStatement(variable, type, start, stop,
                iteration.inclusive, block, iteration.span);
    }

    default ConsoleStatement reduceConsole(ConsoleStatement console, ConsoleFunction function) {
        return new ConsoleStatement(function, console.span);
    }

    default ExpressionStatement reduceExpressionStatement(
            ExpressionStatement expressionStatement, Expression expression) {
        return new ExpressionStatement(expression, expressionStatement.span);
    }

    default Block reduceBlock(Block block, List<Statement> statements) {
        return new Block(statements, block.span);
    }

    ////////////////////// Programs

    default Program reduceProgram(
            Program program,
            List<FunctionInput> expectedInput,
            List<ImportStatement> importStatements,
            Map<List<String>, Program> imports,
            Map<Identifier, Alias> aliases,
            Map<Identifier, Circuit> circuits,
            Map<Identifier, Function> functions,
            Map<List<Identifier>, DefinitionStatement> globalConsts) {
        return new Program(program.name, expectedInput, importStatements, imports,
                aliases, circuits, functions, globalConsts);
    }

    default FunctionInputVariable reduceFunctionInputVariable(
            FunctionInputVariable variable, Identifier identifier, Type type) {
        return new FunctionInputVariable(identifier, variable.isConst, variable.mutable, type, variable.span);
    }

    default FunctionInput reduceFunctionInput(FunctionInput input, FunctionInput newInput) {
        return newInput;
    }

    default ImportTree reduceImportTree(ImportTree tree, ImportTree newTree) {
        return newTree;
    }

    default ImportStatement reduceImportStatement(ImportStatement importStatement, ImportTree tree) {
        return new ImportStatement(tree, importStatement.span);
    }

    /** Called for each resolved import after the imported program was reduced.
     * @param path   Qualified path of the import.
     * @param program  The reduced imported program. */
    default Map.Entry<List<String>, Program> reduceImport(List<String> path, Program program) {
        return new AbstractMap.SimpleImmutableEntry<>(path, program);
    }

    default CircuitMember reduceCircuitMember(CircuitMember member, CircuitMember newMember) {
        return newMember;
    }

    default Circuit reduceCircuit(Circuit circuit, Identifier circuitName, List<CircuitMember> members) {
        return new Circuit(circuitName, members);
    }

    default Alias reduceAlias(Alias alias, Identifier name, Type represents) {
        return new Alias(name, represents, alias.span);
    }

    default Annotation reduceAnnotation(Annotation annotation, Identifier name) {
        return new Annotation(name, annotation.arguments, annotation.span);
    }

    /** The result gets a fresh core mapping cell holding the same value. */
    default Function reduceFunction(
            Function function, Identifier identifier, Map<String, Annotation> annotations,
            List<FunctionInput> inputs, boolean isConst, Type output, Block block) {
        return new Function(identifier, annotations, inputs, isConst, output, block,
                function.coreMapping.copy(), function.span);
    }
}
