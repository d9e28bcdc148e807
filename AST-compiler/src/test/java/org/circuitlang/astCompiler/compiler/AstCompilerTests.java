package org.circuitlang.astCompiler.compiler;

import org.circuitlang.astCompiler.ast.AstFixtures;
import org.circuitlang.astCompiler.ast.expression.CallExpression;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.expression.literal.ImplicitLiteral;
import org.circuitlang.astCompiler.ast.expression.literal.IntegerLiteral;
import org.circuitlang.astCompiler.ast.program.Function;
import org.circuitlang.astCompiler.ast.program.Program;
import org.circuitlang.astCompiler.ast.type.IntegerType;
import org.circuitlang.astCompiler.compiler.errors.CompilationError;
import org.circuitlang.astCompiler.compiler.errors.CompilerMessages;
import org.circuitlang.astCompiler.compiler.reducer.AbstractReconstructingReducer;
import org.circuitlang.astCompiler.compiler.reducer.IdentityReducer;
import org.circuitlang.astCompiler.compiler.reducer.ReducerPasses;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class AstCompilerTests {
    /** Rejects every call to a function named 'forbidden'. */
    static class ForbidCalls extends AbstractReconstructingReducer {
        @Override
        public CallExpression reduceCall(CallExpression call, Expression function, List<Expression> arguments) {
            if (function.is(Identifier.class) && function.to(Identifier.class).name.equals("forbidden"))
                throw new CompilationError("Call to forbidden function", call);
            return super.reduceCall(call, function, arguments);
        }
    }

    /** Gives every implicit literal the u32 type. */
    static class TypeLiterals extends AbstractReconstructingReducer {
        @Override
        public Expression reduceExpression(Expression expression, Expression newExpression) {
            if (newExpression.is(ImplicitLiteral.class)) {
                ImplicitLiteral literal = newExpression.to(ImplicitLiteral.class);
                return new IntegerLiteral(IntegerType.U32, literal.value, literal.span);
            }
            return newExpression;
        }
    }

    static AstCompiler compiler(boolean throwOnError) {
        CompilerOptions options = new CompilerOptions();
        options.reductionOptions.throwOnError = throwOnError;
        return new AstCompiler(options);
    }

    Program forbiddenProgram(AstFixtures fixtures) {
        return fixtures.program("p",
                fixtures.function("ok", fixtures.expressionStatement(fixtures.call("allowed"))),
                fixtures.function("bad", fixtures.expressionStatement(fixtures.call("forbidden"))),
                fixtures.function("worse", fixtures.expressionStatement(fixtures.call("forbidden", fixtures.num("1")))));
    }

    @Test
    public void passesTest() {
        AstFixtures fixtures = new AstFixtures();
        Program program = fixtures.program("p",
                fixtures.function("f", fixtures.expressionStatement(fixtures.num("4"))));
        AstCompiler compiler = compiler(false);
        Program result = compiler.compile(program, new ReducerPasses(new IdentityReducer(), new TypeLiterals()));
        Assert.assertNotNull(result);
        Assert.assertFalse(compiler.hasErrors());
        Function f = result.getFunction("f");
        Assert.assertNotNull(f);
        Assert.assertEquals("4u32;", f.block.statements.get(0).toString());
    }

    @Test
    public void passesAreAppliedInOrderTest() {
        ReducerPasses passes = new ReducerPasses();
        passes.add(new TypeLiterals());
        passes.add(new IdentityReducer());
        Assert.assertEquals(2, passes.passes.size());
        Assert.assertTrue(passes.passes.get(0) instanceof TypeLiterals);
    }

    @Test
    public void compileReportsErrorTest() {
        AstFixtures fixtures = new AstFixtures();
        AstCompiler compiler = compiler(false);
        Program result = compiler.compile(forbiddenProgram(fixtures), new ReducerPasses(new ForbidCalls()));
        Assert.assertNull(result);
        Assert.assertTrue(compiler.hasErrors());
        CompilerMessages messages = compiler.messages;
        Assert.assertEquals(1, messages.errorCount());
        CompilerMessages.Message message = messages.getError(0);
        Assert.assertEquals("Call to forbidden function", message.message);
        Assert.assertEquals("Compilation error", message.errorType);
        Assert.assertTrue(message.span.isKnown());
        Assert.assertEquals("test.circuit", message.span.path);
    }

    @Test
    public void compileThrowsTest() {
        AstFixtures fixtures = new AstFixtures();
        AstCompiler compiler = compiler(true);
        Assert.assertThrows(CompilationError.class,
                () -> compiler.compile(forbiddenProgram(fixtures), new ReducerPasses(new ForbidCalls())));
        Assert.assertEquals(1, compiler.messages.errorCount());
    }

    @Test
    public void internalErrorTest() {
        AstFixtures fixtures = new AstFixtures();
        AstCompiler compiler = compiler(false);
        AbstractReconstructingReducer broken = new AbstractReconstructingReducer() {
            @Override
            public Identifier reduceIdentifier(Identifier identifier) {
                throw new IllegalStateException("broken reducer");
            }
        };
        Program result = compiler.compile(fixtures.program("p", fixtures.function("f")), new ReducerPasses(broken));
        Assert.assertNull(result);
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertEquals("broken reducer", compiler.messages.getError(0).message);
        Assert.assertTrue(compiler.messages.getError(0).errorType.contains("bug"));
    }

    @Test
    public void reduceFunctionsTest() {
        AstFixtures fixtures = new AstFixtures();
        Program program = forbiddenProgram(fixtures);
        AstCompiler compiler = compiler(false);
        Program result = compiler.reduceFunctions(program, ForbidCalls::new);
        Assert.assertEquals(2, compiler.messages.errorCount());
        // Failed functions are kept unchanged
        Assert.assertSame(program.getFunction("bad"), result.getFunction("bad"));
        Assert.assertSame(program.getFunction("worse"), result.getFunction("worse"));
        Assert.assertEquals(program.getFunction("ok"), result.getFunction("ok"));
        Assert.assertNotSame(program.getFunction("ok"), result.getFunction("ok"));
        Assert.assertThrows(CompilationError.class, compiler::throwIfErrorsOccurred);
    }

    @Test
    public void reduceFunctionsThrowsTest() {
        AstFixtures fixtures = new AstFixtures();
        AstCompiler compiler = compiler(true);
        Assert.assertThrows(CompilationError.class,
                () -> compiler.reduceFunctions(forbiddenProgram(fixtures), ForbidCalls::new));
        Assert.assertEquals(1, compiler.messages.errorCount());
    }

    @Test
    public void noErrorsTest() {
        AstCompiler compiler = compiler(false);
        Program program = new AstFixtures().everyKind();
        Program result = compiler.reduce(program, new IdentityReducer());
        Assert.assertEquals(program, result);
        Assert.assertFalse(compiler.hasErrors());
        compiler.throwIfErrorsOccurred();
    }
}
