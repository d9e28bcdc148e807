package org.circuitlang.util;

/** An {@link IndentStream} that accumulates its output in memory. */
public class IndentStreamBuilder extends IndentStream {
    public IndentStreamBuilder() {
        super(new StringBuilder());
    }
}
