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

package org.circuitlang.astCompiler.compiler.errors;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;

import javax.annotation.Nullable;

/** Thrown by a pass that meets a legal construct it does not handle yet. */
public class UnimplementedException extends BaseCompilerException {
    @Nullable
    public final AstNode astNode;

    public static final String KIND = "Not yet implemented";

    public UnimplementedException(String message, AstNode node) {
        super(message + " " + node.getClass().getSimpleName() + ":" + node, node.getSpan());
        this.astNode = node;
    }

    public UnimplementedException(String message) {
        super(message, Span.NONE);
        this.astNode = null;
    }

    public UnimplementedException() {
        this(KIND);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
