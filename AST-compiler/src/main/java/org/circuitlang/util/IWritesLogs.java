package org.circuitlang.util;

/** Marker for classes whose logging level can be controlled through {@link Logger}. */
public interface IWritesLogs {}
