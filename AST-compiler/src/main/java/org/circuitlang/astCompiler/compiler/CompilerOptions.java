/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.circuitlang.astCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.errors.CompilationError;
import org.circuitlang.astCompiler.compiler.errors.CompilerMessages;
import org.circuitlang.util.Logger;

import java.util.HashMap;
import java.util.Map;

/** Options for the AST compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;

        public boolean validate(CompilerMessages reporter) {
            if (this.verbosity < 0) {
                reporter.reportProblem(Span.NONE, false, "Invalid options",
                        "Verbosity cannot be negative: " + this.verbosity);
                return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tloggingLevel=" + this.loggingLevel +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    '}';
        }
    }

    /** Options that control how passes are applied to a program. */
    @SuppressWarnings("CanBeFinal")
    public static class Reduction {
        @Parameter(names = "--checkImportCycles",
                description = "Fail when a program imports itself, directly or indirectly")
        public boolean checkImportCycles = false;
        /** Useful for development */
        @Parameter(names = "--throwOnError", hidden = true,
                description = "Throw compilation errors instead of reporting them")
        public boolean throwOnError = false;

        @Override
        public String toString() {
            return "Reduction{" +
                    "\n\tcheckImportCycles=" + this.checkImportCycles +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Reduction reductionOptions = new Reduction();

    public CompilerOptions() {}

    /**
     * Parse command-line style options.  Logging levels given with -T are
     * applied to the {@link Logger} immediately.
     * @throws CompilationError if the options cannot be parsed.
     */
    public static CompilerOptions parse(String... argv) {
        CompilerOptions options = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("ast-compiler");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            throw new CompilationError(ex.getMessage());
        }
        options.applyLoggingLevels();
        return options;
    }

    void applyLoggingLevels() {
        for (Map.Entry<String, String> entry: this.ioOptions.loggingLevel.entrySet()) {
            int level;
            try {
                level = Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new CompilationError(
                        "-T option must be followed by 'class=number'; could not parse " + entry);
            }
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    public boolean validate(CompilerMessages reporter) {
        return this.ioOptions.validate(reporter);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nreductionOptions=" + this.reductionOptions +
                "\n}";
    }
}
