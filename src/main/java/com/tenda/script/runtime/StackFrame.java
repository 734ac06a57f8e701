package com.tenda.script.runtime;

/** One activation: a module's top level, a block, or a call. */
public final class StackFrame {
    public enum Kind { GLOBAL, BLOCK, CALL }

    public final Kind kind;
    public final Environment env;
    /** Callee name for CALL frames, used in traces. */
    public final String functionName;
    /**
     * For CALL frames: the top-level Environment of the module that defined the
     * callee. Globals are resolved there, never in the caller's frames.
     */
    public final Environment home;

    private StackFrame(Kind kind, Environment env, String functionName, Environment home) {
        this.kind = kind;
        this.env = (env == null) ? new Environment() : env;
        this.functionName = functionName;
        this.home = home;
    }

    public static StackFrame global() {
        return new StackFrame(Kind.GLOBAL, new Environment(), null, null);
    }

    public static StackFrame block() {
        return new StackFrame(Kind.BLOCK, new Environment(), null, null);
    }

    public static StackFrame block(Environment env) {
        return new StackFrame(Kind.BLOCK, env, null, null);
    }

    public static StackFrame call(String functionName, Environment env, Environment home) {
        return new StackFrame(Kind.CALL, env, functionName, home);
    }

    @Override
    public String toString() {
        return kind + (functionName == null ? "" : "(" + functionName + ")") + env.names();
    }
}
