package org.circuitlang.util;

/** Objects with a unique numeric id, used for logging. */
public interface IHasId {
    long getId();
}
