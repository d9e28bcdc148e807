package org.circuitlang.astCompiler.compiler.errors;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;

/** A reduction failure raised by a compiler pass; it always names the
 * span of the node whose reduction failed. */
public class CompilationError extends BaseCompilerException {
    public CompilationError(String message, Span span) {
        super(message, span);
    }

    public CompilationError(String message, AstNode node) {
        super(message, node.getSpan());
    }

    public CompilationError(String message) {
        super(message, Span.NONE);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
