package org.circuitlang.astCompiler.compiler.errors;

import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.IHasSourcePositionRange;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler.
 * Every exception is attributed to the span of one node. */
public abstract class BaseCompilerException
        extends RuntimeException
        implements IHasSourcePositionRange {
    public final Span span;

    protected BaseCompilerException(String message, Span span, @Nullable Throwable throwable) {
        super(message, throwable);
        this.span = span;
    }

    protected BaseCompilerException(String message, Span span) {
        this(message, span, null);
    }

    public Span getSpan() {
        return this.span;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.span.getPositionRange();
    }

    public abstract String getErrorKind();
}
