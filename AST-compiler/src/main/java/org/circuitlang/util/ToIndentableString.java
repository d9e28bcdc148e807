package org.circuitlang.util;

/** Objects that can print themselves on an {@link IIndentStream}. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
