package org.circuitlang.astCompiler.ast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.compiler.IHasSourcePositionRange;
import org.circuitlang.astCompiler.compiler.errors.SourcePositionRange;

import java.util.Objects;

/**
 * Location of a node in the source text.
 * Spans are produced by the parser and are copied unchanged by every
 * rewrite that does not explicitly relocate a node.
 */
public final class Span implements IHasSourcePositionRange {
    /** Used by nodes that have no source location of their own. */
    public static final Span NONE = new Span(0, 0, SourcePositionRange.INVALID, "");

    /** Byte offset of the first character. */
    public final int lo;
    /** Byte offset after the last character. */
    public final int hi;
    public final SourcePositionRange range;
    public final String path;

    public Span(int lo, int hi, SourcePositionRange range, String path) {
        this.lo = lo;
        this.hi = hi;
        this.range = range;
        this.path = path;
    }

    public Span(int lo, int hi) {
        this(lo, hi, SourcePositionRange.INVALID, "");
    }

    public boolean isKnown() {
        return !this.equals(NONE);
    }

    public String getSourceFileName() {
        return this.path.isEmpty() ? "(no input file)" : this.path;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("lo", this.lo);
        result.put("hi", this.hi);
        result.put("path", this.path);
        this.range.appendAsJson(result);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Span span = (Span) o;
        return this.lo == span.lo && this.hi == span.hi &&
                this.range.equals(span.range) && this.path.equals(span.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.lo, this.hi, this.range, this.path);
    }

    @Override
    public String toString() {
        if (this.range.isValid())
            return this.range.toString();
        return "[" + this.lo + ", " + this.hi + ")";
    }
}
