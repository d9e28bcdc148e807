package org.circuitlang.astCompiler.ast;

import com.fasterxml.jackson.databind.JsonNode;
import org.circuitlang.astCompiler.ast.expression.ArrayRangeAccess;
import org.circuitlang.astCompiler.ast.expression.BinaryExpression;
import org.circuitlang.astCompiler.ast.expression.BinaryOperation;
import org.circuitlang.astCompiler.ast.expression.CastExpression;
import org.circuitlang.astCompiler.ast.expression.CircuitVariableInitializer;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.expression.SpreadOrExpression;
import org.circuitlang.astCompiler.ast.expression.TernaryExpression;
import org.circuitlang.astCompiler.ast.expression.literal.Char;
import org.circuitlang.astCompiler.ast.expression.literal.FieldLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.ImplicitLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.StringLiteral;
import org.circuitlang.astCompiler.ast.program.Circuit;
import org.circuitlang.astCompiler.ast.program.CircuitMember;
import org.circuitlang.astCompiler.ast.program.Function;
import org.circuitlang.astCompiler.ast.program.Program;
import org.circuitlang.astCompiler.ast.statement.ConditionalStatement;
import org.circuitlang.astCompiler.ast.statement.ConsoleArgs;
import org.circuitlang.astCompiler.ast.statement.ConsoleAssert;
import org.circuitlang.astCompiler.ast.statement.ConsoleFormat;
import org.circuitlang.astCompiler.ast.type.IntegerType;
import org.circuitlang.astCompiler.ast.type.TypeArray;
import org.circuitlang.astCompiler.ast.type.TypeInteger;
import org.circuitlang.astCompiler.ast.type.TypePrimitive;
import org.circuitlang.astCompiler.ast.type.TypeTuple;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class AstNodeTests {
    @Test
    public void equalityIgnoresIdTest() {
        Identifier first = new Identifier("x", new Span(3, 4));
        Identifier second = new Identifier("x", new Span(3, 4));
        Assert.assertNotEquals(first.getId(), second.getId());
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void equalityUsesSpansTest() {
        Identifier first = new Identifier("x", new Span(3, 4));
        Identifier moved = new Identifier("x", new Span(5, 6));
        Assert.assertNotEquals(first, moved);
        Assert.assertEquals(AstJson.withoutSpans(first), AstJson.withoutSpans(moved));
    }

    @Test
    public void printTest() {
        Expression a = new Identifier("a", new Span(0, 1));
        Expression cast = new CastExpression(new ImplicitLiteral("3", new Span(2, 3)),
                new TypeInteger(IntegerType.U8), new Span(2, 9));
        Expression ternary = new TernaryExpression(a, cast,
                new FieldLiteral("1", new Span(10, 16)), new Span(0, 16));
        Assert.assertEquals("(a ? (3 as u8) : 1field)", ternary.toString());
        Expression range = new ArrayRangeAccess(a, null, new ImplicitLiteral("2", Span.NONE), Span.NONE);
        Assert.assertEquals("a[..2]", range.toString());
        Assert.assertEquals("\"hi\"", StringLiteral.of("hi", Span.NONE).toString());
        Assert.assertEquals("\\u{d800}", new Char(0xD800, false).toString());
    }

    @Test
    public void printTypesTest() {
        Assert.assertEquals("[u32; (2, 3)]",
                new TypeArray(new TypeInteger(IntegerType.U32), ArrayDimensions.of(2, 3)).toString());
        Assert.assertEquals("[char; _]",
                new TypeArray(new TypePrimitive(TypePrimitive.Kind.CHAR), null).toString());
        Assert.assertEquals("(field, bool)", new TypeTuple(new TypePrimitive(TypePrimitive.Kind.FIELD),
                new TypePrimitive(TypePrimitive.Kind.BOOLEAN)).toString());
        Assert.assertFalse(new TypeInteger(IntegerType.U32).span.isKnown());
    }

    @Test
    public void conditionalPrintTest() {
        AstFixtures fixtures = new AstFixtures();
        ConditionalStatement conditional = new ConditionalStatement(fixtures.id("c"), fixtures.block(),
                new ConditionalStatement(fixtures.id("d"), fixtures.block(), fixtures.block(), fixtures.span()),
                fixtures.span());
        Assert.assertEquals("if c {} else if d {} else {}", conditional.toString());
    }

    @Test
    public void jsonTest() {
        BinaryExpression sum = new BinaryExpression(
                new ImplicitLiteral("1", new Span(0, 1)),
                new ImplicitLiteral("2", new Span(4, 5)),
                BinaryOperation.ADD, new Span(0, 5));
        JsonNode json = sum.toJson();
        Assert.assertEquals("BinaryExpression", json.get("class").asText());
        Assert.assertEquals("ADD", json.get("operation").asText());
        Assert.assertEquals(4, json.get("right").get("span").get("lo").asInt());
        Assert.assertFalse(AstJson.withoutSpans(sum).get("right").has("span"));
        Assert.assertTrue(AstJson.toJsonString(sum).contains("\"class\" : \"ImplicitLiteral\""));
    }

    @Test
    public void programJsonTest() {
        Program program = new AstFixtures().everyKind();
        JsonNode json = program.toJson();
        Assert.assertEquals("main", json.get("name").asText());
        Assert.assertTrue(json.get("imports").has("lib"));
        Assert.assertTrue(json.get("circuits").has("Point"));
        Assert.assertTrue(json.get("functions").has("main"));
        Assert.assertTrue(json.get("globalConsts").has("LIMIT"));
        Assert.assertTrue(json.get("aliases").has("Chars"));
        Assert.assertFalse(json.has("span"));
    }

    @Test
    public void programTablesAreCopiesTest() {
        AstFixtures fixtures = new AstFixtures();
        Program program = fixtures.program("p", fixtures.function("b"), fixtures.function("a"));
        List<String> names = new ArrayList<>();
        for (Identifier identifier: program.functions.keySet())
            names.add(identifier.name);
        Assert.assertEquals(List.of("b", "a"), names);
        Assert.assertThrows(UnsupportedOperationException.class, () -> program.functions.clear());
        Assert.assertNull(program.getFunction("c"));
    }

    @Test
    public void childSpanTest() {
        Expression value = new ImplicitLiteral("1", new Span(4, 5));
        Identifier name = new Identifier("x", new Span(0, 1));
        Assert.assertEquals(value.span, SpreadOrExpression.spread(value).span);
        Assert.assertEquals(value.span, new ConsoleAssert(value).span);
        ConsoleArgs args = new ConsoleArgs(List.of(), List.of(value), new Span(8, 20));
        Assert.assertEquals(args.span, new ConsoleFormat(ConsoleFormat.Kind.LOG, args).span);
        Assert.assertEquals(name.span, new CircuitVariableInitializer(name, null).span);

        Function method = new AstFixtures().function("get_x");
        List<CircuitMember> members = List.of(
                new CircuitMember.CircuitConst(name, AstFixtures.u32Type(), value),
                new CircuitMember.CircuitVariable(name, AstFixtures.u32Type()),
                new CircuitMember.CircuitFunction(method));
        Assert.assertEquals(name.span, members.get(0).span);
        Assert.assertEquals(name.span, members.get(1).span);
        Assert.assertEquals(method.span, members.get(2).span);
        Identifier circuitName = new Identifier("Point", new Span(30, 35));
        Assert.assertEquals(circuitName.span, new Circuit(circuitName, members).span);
    }
}
