package org.circuitlang.astCompiler.ast.statement;

import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;

/** What a console statement does. */
public abstract class ConsoleFunction extends AstNode {
    protected ConsoleFunction(Span span) {
        super(span);
    }

    public abstract ConsoleFunction reconstruct(ReconstructingDirector director);
}
