package org.circuitlang.astCompiler.compiler.errors;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.compiler.IHasSourcePositionRange;

public class SourcePositionRange implements IHasSourcePositionRange {
    public static final SourcePositionRange INVALID =
            new SourcePositionRange(SourcePosition.INVALID, SourcePosition.INVALID);

    public final SourcePosition start;
    public final SourcePosition end;

    public SourcePositionRange(SourcePosition start, SourcePosition end) {
        this.start = start;
        this.end = end;
    }

    public SourcePositionRange(int startLine, int startColumn, int endLine, int endColumn) {
        this(new SourcePosition(startLine, startColumn), new SourcePosition(endLine, endColumn));
    }

    public boolean isValid() {
        return this.start.isValid() && this.end.isValid();
    }

    @Override
    public String toString() {
        return this.start + "--" + this.end;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this;
    }

    /** Append the position information to a JSON node */
    public void appendAsJson(ObjectNode parent) {
        parent.put("start_line_number", this.start.line);
        parent.put("start_column", this.start.column);
        parent.put("end_line_number", this.end.line);
        parent.put("end_column", this.end.column);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;

        SourcePositionRange that = (SourcePositionRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        int result = start.hashCode();
        result = 31 * result + end.hashCode();
        return result;
    }
}
