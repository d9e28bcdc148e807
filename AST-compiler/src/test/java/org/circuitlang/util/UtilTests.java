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

package org.circuitlang.util;

import org.circuitlang.astCompiler.compiler.errors.CompilationError;
import org.circuitlang.astCompiler.compiler.errors.InternalCompilerError;
import org.circuitlang.astCompiler.compiler.reducer.IdentityReducer;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class UtilTests {
    @After
    public void resetLogging() {
        Logger.INSTANCE.reset();
        Logger.INSTANCE.setDebugStream(System.err);
    }

    @Test
    public void indentTest() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        builder.append("{").increase()
                .append("a;").newline()
                .append("b;\nc;").newline()
                .decrease().append("}");
        Assert.assertEquals("{\n    a;\n    b;\n    c;\n}", builder.toString());
    }

    @Test
    public void noIndentTest() {
        IndentStream stream = new IndentStream(new StringBuilder());
        stream.setIndentAmount(0);
        stream.append("a").newline().append("b");
        Assert.assertEquals("ab", stream.toString());
        IndentStreamBuilder unbalanced = new IndentStreamBuilder();
        Assert.assertThrows(RuntimeException.class, unbalanced::decrease);
    }

    @Test
    public void linqTest() {
        List<Integer> data = Linq.list(1, 2, 3, 4);
        Assert.assertEquals(Linq.list("1", "2", "3", "4"), Linq.map(data, Object::toString));
        data.add(5);
        Assert.assertEquals(5, data.size());
    }

    @Test
    public void utilitiesTest() {
        List<String> stack = new ArrayList<>(List.of("a", "b"));
        Assert.assertEquals("b", Utilities.removeLast(stack));
        Assert.assertEquals(List.of("a"), stack);
        Assert.assertThrows(InternalCompilerError.class, () -> Utilities.enforce(false, "broken"));
        Map<String, Integer> table = new LinkedHashMap<>();
        Assert.assertEquals(Integer.valueOf(1), Utilities.putNew(table, "a", 1));
        Assert.assertThrows(InternalCompilerError.class, () -> Utilities.putNew(table, "a", 2));
        Assert.assertEquals(Integer.valueOf(2), table.get("a"));
    }

    @Test
    public void cellTest() {
        Cell<String> cell = Cell.empty();
        Assert.assertFalse(cell.isSet());
        cell.set("core");
        Cell<String> copy = cell.copy();
        Assert.assertEquals(cell, copy);
        copy.set("other");
        Assert.assertEquals("core", cell.get());
        Assert.assertNotEquals(cell, copy);
    }

    @Test
    public void loggerTest() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(ReconstructingDirector.class));
        Logger.INSTANCE.belowLevel(ReconstructingDirector.class, 1).append("hidden");
        Assert.assertEquals(0, Logger.INSTANCE.setLoggingLevel("ReconstructingDirector", 1));
        Logger.INSTANCE.belowLevel(ReconstructingDirector.class, 1).append("shown");
        Logger.INSTANCE.belowLevel(ReconstructingDirector.class, 2).append("too detailed");
        Assert.assertEquals("shown", builder.toString());
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(IdentityReducer.class));
    }

    @Test
    public void loggerSubclassTest() {
        Logger.INSTANCE.setLoggingLevel(IWritesLogs.class, 3);
        Assert.assertEquals(3, Logger.INSTANCE.getLoggingLevel(IdentityReducer.class));
        Assert.assertThrows(CompilationError.class, () -> Logger.INSTANCE.setLoggingLevel("a.b.Missing", 1));
    }
}
