package org.circuitlang.astCompiler.ast;

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
import org.circuitlang.astCompiler.ast.expression.literal.AddressLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.BoolLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.Char;
import org.circuitlang.astCompiler.ast.expression.literal.CharLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.FieldLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.GroupCoordinate;
import org.circuitlang.astCompiler.ast.expression.literal.GroupLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.GroupTuple;
import org.circuitlang.astCompiler.ast.expression.literal.GroupValueSingle;
import org.circuitlang.astCompiler.ast.expression.literal.ImplicitLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.IntegerLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.StringLiteral;
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
import org.circuitlang.astCompiler.ast.statement.AssignOperation;
import org.circuitlang.astCompiler.ast.statement.AssignStatement;
import org.circuitlang.astCompiler.ast.statement.Assignee;
import org.circuitlang.astCompiler.ast.statement.AssigneeAccess;
import org.circuitlang.astCompiler.ast.statement.Block;
import org.circuitlang.astCompiler.ast.statement.ConditionalStatement;
import org.circuitlang.astCompiler.ast.statement.ConsoleArgs;
import org.circuitlang.astCompiler.ast.statement.ConsoleAssert;
import org.circuitlang.astCompiler.ast.statement.ConsoleFormat;
import org.circuitlang.astCompiler.ast.statement.ConsoleStatement;
import org.circuitlang.astCompiler.ast.statement.DefinitionStatement;
import org.circuitlang.astCompiler.ast.statement.ExpressionStatement;
import org.circuitlang.astCompiler.ast.statement.IterationStatement;
import org.circuitlang.astCompiler.ast.statement.ReturnStatement;
import org.circuitlang.astCompiler.ast.statement.Statement;
import org.circuitlang.astCompiler.ast.statement.VariableName;
import org.circuitlang.astCompiler.ast.type.IntegerType;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.ast.type.TypeArray;
import org.circuitlang.astCompiler.ast.type.TypeIdentifier;
import org.circuitlang.astCompiler.ast.type.TypeInteger;
import org.circuitlang.astCompiler.ast.type.TypePrimitive;
import org.circuitlang.astCompiler.ast.type.TypeTuple;
import org.circuitlang.astCompiler.compiler.errors.SourcePositionRange;
import org.circuitlang.util.Cell;
import org.circuitlang.util.Linq;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds trees for tests.  Every node gets a distinct span. */
public class AstFixtures {
    private int next = 0;
    public final String path;

    public AstFixtures(String path) {
        this.path = path;
    }

    public AstFixtures() {
        this("test.circuit");
    }

    public Span span() {
        int lo = this.next;
        this.next += 2;
        return new Span(lo, lo + 1, SourcePositionRange.INVALID, this.path);
    }

    public Identifier id(String name) {
        return new Identifier(name, this.span());
    }

    public Expression num(String value) {
        return new ImplicitLiteral(value, this.span());
    }

    public Expression u32(int value) {
        return new IntegerLiteral(IntegerType.U32, Integer.toString(value), this.span());
    }

    public Expression binary(Expression left, BinaryOperation operation, Expression right) {
        return new BinaryExpression(left, right, operation, this.span());
    }

    public Expression call(String function, Expression... arguments) {
        return new CallExpression(this.id(function), Linq.list(arguments), this.span());
    }

    public Statement expressionStatement(Expression expression) {
        return new ExpressionStatement(expression, this.span());
    }

    public Block block(Statement... statements) {
        return new Block(Linq.list(statements), this.span());
    }

    public static Type u32Type() {
        return new TypeInteger(IntegerType.U32);
    }

    public Function function(String name, List<FunctionInput> inputs, Type output, Block block) {
        return new Function(this.id(name), Map.of(), inputs, false, output, block,
                Cell.empty(), this.span());
    }

    public Function function(String name, Statement... statements) {
        return this.function(name, List.of(), u32Type(), this.block(statements));
    }

    /** A program containing only the given functions, in order. */
    public Program program(String name, Function... functions) {
        Map<Identifier, Function> map = new LinkedHashMap<>();
        for (Function function: functions)
            map.put(function.identifier, function);
        return new Program(name, List.of(), List.of(), Map.of(), Map.of(), Map.of(), map, Map.of());
    }

    /** A program that uses every kind of node at least once. */
    public Program everyKind() {
        Program imported = this.program("lib", this.function("helper",
                new ReturnStatement(this.u32(1), this.span())));

        // Types
        Type point = new TypeIdentifier(this.id("Point"));
        Type pair = new TypeTuple(new TypePrimitive(TypePrimitive.Kind.FIELD),
                new TypePrimitive(TypePrimitive.Kind.BOOLEAN));
        Type matrix = new TypeArray(u32Type(), ArrayDimensions.of(2, 3));
        Type inferred = new TypeArray(new TypePrimitive(TypePrimitive.Kind.CHAR), null);

        // Circuit
        Function getX = this.function("get_x",
                List.of(new SelfKeyword(SelfKeyword.Kind.SELF, this.span())),
                u32Type(),
                this.block(new ReturnStatement(
                        new MemberAccess(this.id("self"), this.id("x"), null, this.span()),
                        this.span())));
        Function setX = this.function("set_x",
                List.of(new SelfKeyword(SelfKeyword.Kind.MUT_SELF, this.span()),
                        new FunctionInputVariable(this.id("v"), false, false, u32Type(), this.span())),
                new TypeTuple(List.of()),
                this.block(new AssignStatement(AssignOperation.ASSIGN,
                        new Assignee(this.id("self"),
                                List.of(new AssigneeAccess.Member(this.id("x"))), this.span()),
                        this.id("v"), this.span())));
        Function origin = this.function("origin",
                List.of(new SelfKeyword(SelfKeyword.Kind.CONST_SELF, this.span())),
                new TypePrimitive(TypePrimitive.Kind.SELF_TYPE),
                this.block(new ReturnStatement(new CircuitInitExpression(this.id("Point"),
                        List.of(new CircuitVariableInitializer(this.id("x"), this.u32(0)),
                                new CircuitVariableInitializer(this.id("y"), null)),
                        this.span()), this.span())));
        Circuit circuit = new Circuit(this.id("Point"), List.of(
                new CircuitMember.CircuitConst(this.id("ZERO"), u32Type(), this.u32(0)),
                new CircuitMember.CircuitVariable(this.id("x"), u32Type()),
                new CircuitMember.CircuitVariable(this.id("y"), u32Type()),
                new CircuitMember.CircuitFunction(getX),
                new CircuitMember.CircuitFunction(setX),
                new CircuitMember.CircuitFunction(origin)));

        // Expressions
        Expression literals = new TupleInitExpression(List.of(
                new AddressLiteral("aleo1qnr4dkkvkgfqph0vzc3y6z2eu975wnpz2925ntjccd5cfqxtyu8sta57j8", this.span()),
                new BoolLiteral(true, this.span()),
                new FieldLiteral("3", this.span()),
                new CharLiteral(Char.of('a'), this.span()),
                new CharLiteral(new Char(0xD800, false), this.span()),
                new GroupLiteral(new GroupValueSingle("7", this.span())),
                new GroupLiteral(new GroupTuple(
                        GroupCoordinate.number("0", this.span()),
                        new GroupCoordinate(GroupCoordinate.Kind.SIGN_HIGH, null, this.span()),
                        this.span())),
                StringLiteral.of("hello", this.span()),
                this.num("5")), this.span());
        Expression arrays = new ArrayInlineExpression(List.of(
                SpreadOrExpression.expression(this.u32(1)),
                SpreadOrExpression.spread(new ArrayInitExpression(this.u32(0),
                        ArrayDimensions.of(2), this.span()))), this.span());
        Expression accesses = new TernaryExpression(
                new UnaryExpression(new BoolLiteral(false, this.span()), UnaryOperation.NOT, this.span()),
                new ArrayAccess(this.id("a"), this.u32(0), this.span()),
                new TupleAccess(this.id("t"), new PositiveNumber(1), this.span()),
                this.span());
        Expression ranges = new TupleInitExpression(List.of(
                new ArrayRangeAccess(this.id("a"), this.u32(0), this.u32(2), this.span()),
                new ArrayRangeAccess(this.id("a"), null, null, this.span()),
                new MemberAccess(this.id("p"), this.id("x"), u32Type(), this.span()),
                new StaticAccess(this.id("Point"), this.id("origin"), new Cell<>(point), this.span()),
                new StaticAccess(this.id("Point"), this.id("ZERO"), Cell.empty(), this.span()),
                new CastExpression(this.id("n"), new TypePrimitive(TypePrimitive.Kind.FIELD), this.span())),
                this.span());

        // Statements
        Statement definition = new DefinitionStatement(DefinitionStatement.Declare.LET,
                List.of(new VariableName(true, this.id("a"), this.span()),
                        new VariableName(false, this.id("t"), this.span())),
                true, new TypeTuple(matrix, pair), new TupleInitExpression(List.of(arrays, literals), this.span()),
                this.span());
        Statement assign = new AssignStatement(AssignOperation.ADD,
                new Assignee(this.id("a"), List.of(
                        new AssigneeAccess.ArrayIndex(this.u32(0)),
                        new AssigneeAccess.ArrayRange(this.u32(0), null),
                        new AssigneeAccess.Tuple(new PositiveNumber(0), this.span()),
                        new AssigneeAccess.Member(this.id("x"))), this.span()),
                this.binary(this.u32(1), BinaryOperation.MUL, this.u32(2)), this.span());
        Statement conditional = new ConditionalStatement(
                this.binary(this.id("n"), BinaryOperation.LT, this.u32(10)),
                this.block(this.expressionStatement(accesses)),
                new ConditionalStatement(new BoolLiteral(true, this.span()),
                        this.block(this.expressionStatement(ranges)),
                        this.block(), this.span()),
                this.span());
        Statement loop = new IterationStatement(this.id("i"), u32Type(), this.u32(0), this.u32(4), true,
                this.block(
                        new ConsoleStatement(new ConsoleAssert(this.binary(this.id("i"), BinaryOperation.LE,
                                this.u32(4))), this.span()),
                        new ConsoleStatement(new ConsoleFormat(ConsoleFormat.Kind.LOG,
                                new ConsoleArgs(StringLiteral.of("i = {}", Span.NONE).characters,
                                        List.of(this.id("i")), this.span())), this.span()),
                        new ConsoleStatement(new ConsoleFormat(ConsoleFormat.Kind.ERROR,
                                new ConsoleArgs(List.of(), List.of(), this.span())), this.span()),
                        new ConditionalStatement(this.id("done"), this.block(), null, this.span())),
                this.span());
        Statement call = this.expressionStatement(this.call("helper", this.u32(3)));

        Map<String, Annotation> annotations = new LinkedHashMap<>();
        annotations.put("test", new Annotation(this.id("test"), List.of(), this.span()));
        annotations.put("context", new Annotation(this.id("context"), List.of("a", "b"), this.span()));
        Function main = new Function(this.id("main"), annotations,
                List.of(new FunctionInputVariable(this.id("n"), true, false, u32Type(), this.span()),
                        new FunctionInputVariable(this.id("p"), false, true, point, this.span())),
                false, u32Type(),
                this.block(definition, assign, conditional, loop, call,
                        new ReturnStatement(this.id("n"), this.span())),
                new Cell<>("core_main"), this.span());

        Map<List<String>, Program> imports = new LinkedHashMap<>();
        imports.put(List.of("lib"), imported);
        Map<Identifier, Alias> aliases = new LinkedHashMap<>();
        Identifier aliasName = this.id("Chars");
        aliases.put(aliasName, new Alias(aliasName, inferred, this.span()));
        Map<Identifier, Circuit> circuits = new LinkedHashMap<>();
        circuits.put(circuit.circuitName, circuit);
        Map<Identifier, Function> functions = new LinkedHashMap<>();
        functions.put(main.identifier, main);
        Map<List<Identifier>, DefinitionStatement> globalConsts = new LinkedHashMap<>();
        Identifier limit = this.id("LIMIT");
        globalConsts.put(List.of(limit), new DefinitionStatement(DefinitionStatement.Declare.CONST,
                List.of(new VariableName(false, limit, this.span())), false,
                new TypeInteger(IntegerType.I8), new IntegerLiteral(IntegerType.I8, "-1", this.span()),
                this.span()));

        List<ImportStatement> importStatements = List.of(
                new ImportStatement(ImportTree.glob(List.of(this.id("lib")), this.span()), this.span()),
                new ImportStatement(ImportTree.leaf(List.of(this.id("lib"), this.id("helper")),
                        this.id("h"), this.span()), this.span()),
                new ImportStatement(ImportTree.nested(List.of(this.id("lib")), List.of(
                        ImportTree.leaf(List.of(this.id("helper")), null, this.span()),
                        ImportTree.glob(List.of(this.id("inner")), this.span())), this.span()), this.span()));
        List<FunctionInput> expectedInput = List.of(
                new FunctionInputVariable(this.id("registers"), false, false,
                        new TypePrimitive(TypePrimitive.Kind.ADDRESS), this.span()));
        return new Program("main", expectedInput, importStatements, imports,
                aliases, circuits, functions, globalConsts);
    }
}
