package com.tenda.script.runtime;

import com.tenda.script.ast.SourceSpan;

/**
 * Facts attached to a {@link Function} after it is built. A self name makes the
 * function visible to its own body under that name: it is bound into each call
 * frame, so the enclosing declaration does not need to have completed.
 */
public final class FunctionMetadata {
    public final String name;          // may be null
    public final SourceSpan span;      // may be null
    public final boolean bindSelf;
    public final boolean selfCaptured;

    private FunctionMetadata(String name, SourceSpan span, boolean bindSelf, boolean selfCaptured) {
        this.name = name;
        this.span = span;
        this.bindSelf = bindSelf;
        this.selfCaptured = selfCaptured;
    }

    /** A declared function that can call itself by {@code name}. */
    public static FunctionMetadata named(String name, SourceSpan span, boolean selfCaptured) {
        if (name == null) throw new IllegalArgumentException("name");
        return new FunctionMetadata(name, span, true, selfCaptured);
    }

    public static FunctionMetadata anonymous(SourceSpan span) {
        return new FunctionMetadata(null, span, false, false);
    }
}
