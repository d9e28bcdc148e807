package org.circuitlang.astCompiler.compiler.reducer;

/** A reducer that keeps every default; produces a copy of its input. */
public class IdentityReducer extends AbstractReconstructingReducer {}
