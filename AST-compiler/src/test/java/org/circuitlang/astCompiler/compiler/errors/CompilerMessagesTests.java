package org.circuitlang.astCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.compiler.AstCompiler;
import org.circuitlang.astCompiler.compiler.CompilerOptions;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class CompilerMessagesTests {
    static final Span SPAN = new Span(10, 14, new SourcePositionRange(2, 3, 2, 7), "main.circuit");

    @Test
    public void textTest() {
        AstCompiler compiler = new AstCompiler(new CompilerOptions());
        compiler.messages.reportError(new CompilationError("Call to forbidden function", SPAN));
        compiler.messages.reportProblem(new Span(1, 2), true, "Unused", "x is never read");
        String text = compiler.messages.toString();
        Assert.assertTrue(text, text.contains("main.circuit:2:3: error: Compilation error: Call to forbidden function"));
        Assert.assertTrue(text, text.contains("(no input file):[1, 2): warning: Unused: x is never read"));
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals(1, compiler.messages.exitCode);
    }

    @Test
    public void warningsOnlyTest() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.quiet = true;
        AstCompiler compiler = new AstCompiler(options);
        compiler.messages.reportProblem(SPAN, true, "Unused", "x is never read");
        Assert.assertFalse(compiler.hasErrors());
        Assert.assertEquals("", compiler.messages.toString());

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        compiler.showErrors(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        Assert.assertEquals(0, bytes.size());
    }

    @Test
    public void jsonTest() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.emitJsonErrors = true;
        AstCompiler compiler = new AstCompiler(options);
        compiler.messages.reportError(new CompilationError("Import cycle: a -> a"));
        compiler.messages.reportError(new CompilationError("bad", SPAN));
        JsonNode json = compiler.messages.toJson();
        Assert.assertEquals(2, json.size());
        JsonNode first = json.get(0);
        Assert.assertEquals("Import cycle: a -> a", first.get("message").asText());
        Assert.assertEquals("Compilation error", first.get("error_type").asText());
        Assert.assertFalse(first.get("warning").asBoolean());
        JsonNode second = json.get(1);
        Assert.assertEquals(10, second.get("lo").asInt());
        Assert.assertEquals(14, second.get("hi").asInt());
        Assert.assertEquals(2, second.get("start_line_number").asInt());
        Assert.assertEquals(7, second.get("end_column").asInt());
        Assert.assertTrue(compiler.messages.toString().trim().startsWith("["));
    }

    @Test
    public void clearTest() {
        AstCompiler compiler = new AstCompiler(new CompilerOptions());
        compiler.messages.reportError(new InternalCompilerError("oops"));
        Assert.assertTrue(compiler.hasErrors());
        compiler.messages.clear();
        Assert.assertTrue(compiler.messages.isEmpty());
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void unimplementedTest() {
        Identifier node = new Identifier("g", SPAN);
        UnimplementedException exception = new UnimplementedException("Cannot fold", node);
        Assert.assertEquals("Cannot fold Identifier:g", exception.getMessage());
        Assert.assertEquals(UnimplementedException.KIND, exception.getErrorKind());
        Assert.assertEquals(SPAN, exception.getSpan());
        Assert.assertEquals(SPAN.range, exception.getPositionRange());
    }
}
