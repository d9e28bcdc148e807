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

import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.program.Function;
import org.circuitlang.astCompiler.ast.program.Program;
import org.circuitlang.astCompiler.compiler.errors.BaseCompilerException;
import org.circuitlang.astCompiler.compiler.errors.CompilationError;
import org.circuitlang.astCompiler.compiler.errors.CompilerMessages;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingReducer;
import org.circuitlang.astCompiler.compiler.reducer.ReducerPasses;
import org.circuitlang.util.IWritesLogs;
import org.circuitlang.util.Logger;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Applies reducer passes to programs and collects the problems they report.
 * Failures are recorded in {@link #messages}; with the throwOnError option
 * they are also rethrown.
 */
public class AstCompiler implements IWritesLogs {
    public final CompilerOptions options;
    public final CompilerMessages messages;

    public AstCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(this);
    }

    /** Reduce a program with a single reducer.  Exceptions propagate to the caller. */
    public Program reduce(Program program, ReconstructingReducer reducer) {
        return new ReconstructingDirector(this, reducer).apply(program);
    }

    /**
     * Run all passes on a program.
     * @return The reduced program, or null if a pass failed; the failure
     * is in {@link #messages}.
     */
    @Nullable
    public Program compile(Program program, ReducerPasses passes) {
        try {
            return passes.apply(this, program);
        } catch (BaseCompilerException e) {
            this.messages.reportError(e);
            this.rethrow(e);
        } catch (RuntimeException e) {
            this.messages.reportError(e);
            this.rethrow(e);
        }
        return null;
    }

    /**
     * Reduce each function of a program on its own, with a fresh reducer
     * for every function.  A function whose reduction fails is reported and
     * kept unchanged, so that one run can report problems in several functions.
     */
    public Program reduceFunctions(Program program, Supplier<ReconstructingReducer> reducers) {
        Map<Identifier, Function> functions = new LinkedHashMap<>();
        for (Map.Entry<Identifier, Function> entry: program.functions.entrySet()) {
            Function function = entry.getValue();
            ReconstructingDirector director = new ReconstructingDirector(this, reducers.get());
            try {
                function = director.reduceFunction(function);
            } catch (BaseCompilerException e) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Reduction of ")
                        .append(function.getName())
                        .append(" failed: ")
                        .append(e.getMessage())
                        .newline();
                this.messages.reportError(e);
                this.rethrow(e);
            }
            functions.put(entry.getKey(), function);
        }
        return program.withFunctions(functions);
    }

    void rethrow(RuntimeException e) {
        if (this.options.reductionOptions.throwOnError) {
            System.err.println(this.messages);
            throw e;
        }
    }

    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    public void showErrors(PrintStream stream) {
        this.messages.show(stream);
    }

    /** Throw if any error has been encountered.
     * Displays the errors on stderr as well. */
    public void throwIfErrorsOccurred() {
        if (this.hasErrors()) {
            this.showErrors(System.err);
            throw new CompilationError("Error during compilation");
        }
    }
}
