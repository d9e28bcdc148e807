package org.circuitlang.astCompiler.compiler;

import org.circuitlang.astCompiler.compiler.errors.CompilationError;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.astCompiler.compiler.reducer.ReducerPasses;
import org.circuitlang.util.Logger;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class CompilerOptionsTests {
    @After
    public void resetLogging() {
        Logger.INSTANCE.reset();
    }

    @Test
    public void defaultsTest() {
        CompilerOptions options = CompilerOptions.parse();
        Assert.assertFalse(options.reductionOptions.checkImportCycles);
        Assert.assertFalse(options.reductionOptions.throwOnError);
        Assert.assertFalse(options.ioOptions.emitJsonErrors);
        Assert.assertFalse(options.ioOptions.quiet);
        Assert.assertEquals(0, options.ioOptions.verbosity);
        Assert.assertFalse(options.help);
    }

    @Test
    public void parseTest() {
        CompilerOptions options = CompilerOptions.parse(
                "--checkImportCycles", "--throwOnError", "-je", "-q", "-v", "2");
        Assert.assertTrue(options.reductionOptions.checkImportCycles);
        Assert.assertTrue(options.reductionOptions.throwOnError);
        Assert.assertTrue(options.ioOptions.emitJsonErrors);
        Assert.assertTrue(options.ioOptions.quiet);
        Assert.assertEquals(2, options.ioOptions.verbosity);
        Assert.assertTrue(options.toString().contains("checkImportCycles=true"));
    }

    @Test
    public void loggingLevelTest() {
        CompilerOptions options = CompilerOptions.parse("-TReconstructingDirector=2", "-TReducerPasses=1");
        Assert.assertEquals("2", options.ioOptions.loggingLevel.get("ReconstructingDirector"));
        Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(ReconstructingDirector.class));
        Assert.assertEquals(1, Logger.INSTANCE.getLoggingLevel(ReducerPasses.class));
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(AstCompiler.class));
    }

    @Test
    public void qualifiedLoggingLevelTest() {
        CompilerOptions.parse("-Torg.circuitlang.astCompiler.compiler.AstCompiler=3");
        Assert.assertEquals(3, Logger.INSTANCE.getLoggingLevel(AstCompiler.class));
    }

    @Test
    public void badLoggingLevelTest() {
        CompilationError error = Assert.assertThrows(CompilationError.class,
                () -> CompilerOptions.parse("-TReducerPasses=high"));
        Assert.assertTrue(error.getMessage(), error.getMessage().contains("class=number"));
    }

    @Test
    public void unknownClassTest() {
        CompilationError error = Assert.assertThrows(CompilationError.class,
                () -> CompilerOptions.parse("-TNoSuchClass=1"));
        Assert.assertTrue(error.getMessage().contains("NoSuchClass"));
    }

    @Test
    public void unknownOptionTest() {
        Assert.assertThrows(CompilationError.class, () -> CompilerOptions.parse("--noSuchOption"));
    }

    @Test
    public void validateTest() {
        CompilerOptions options = new CompilerOptions();
        AstCompiler compiler = new AstCompiler(options);
        Assert.assertTrue(options.validate(compiler.messages));
        options.ioOptions.verbosity = -1;
        Assert.assertFalse(options.validate(compiler.messages));
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertEquals("Invalid options", compiler.messages.getError(0).errorType);
    }
}
