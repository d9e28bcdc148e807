package org.circuitlang.astCompiler.compiler;

import org.circuitlang.astCompiler.compiler.errors.SourcePositionRange;

public interface IHasSourcePositionRange {
    SourcePositionRange getPositionRange();
}
