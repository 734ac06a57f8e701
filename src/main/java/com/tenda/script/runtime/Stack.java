package com.tenda.script.runtime;

import java.util.ArrayList;
import java.util.List;

import com.tenda.debug.Debug;

/**
 * The live scope chain of one module execution: a global frame, the frames
 * pushed on top of it, and an optional read-only base (the prelude).
 *
 * <p>Resolution walks from the top frame down to the nearest CALL frame, then
 * the callee's home globals, then the base. Outside any call it walks every
 * block frame down to the global frame. The caller's frames are never visible
 * to a callee.
 */
public final class Stack {
    public static final int DEFAULT_MAX_CALL_DEPTH = 512;

    private static final String TAG = "Stack";

    private final StackFrame global = StackFrame.global();
    private final List<StackFrame> frames = new ArrayList<>();
    private final Environment base;
    private final int maxCallDepth;
    private int callDepth = 0;

    public Stack() {
        this(null, DEFAULT_MAX_CALL_DEPTH);
    }

    public Stack(Environment base) {
        this(base, DEFAULT_MAX_CALL_DEPTH);
    }

    public Stack(Environment base, int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.base = base;
        this.maxCallDepth = maxCallDepth;
    }

    // -------------------------
    // Frame lifecycle
    // -------------------------

    /** @throws RuntimeError STACK_OVERFLOW when a CALL frame would exceed the ceiling; nothing is pushed then */
    public void push(StackFrame frame) {
        if (frame.kind == StackFrame.Kind.GLOBAL) {
            throw new IllegalArgumentException("Global frame cannot be pushed");
        }
        if (frame.kind == StackFrame.Kind.CALL) {
            if (callDepth >= maxCallDepth) {
                Debug.get().e(TAG, "call depth ceiling reached (" + maxCallDepth + ") entering " + frame.functionName);
                throw new RuntimeError(Diagnostic.stackOverflow(maxCallDepth));
            }
            callDepth++;
        }
        frames.add(frame);
    }

    public void pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Cannot pop the global frame");
        }
        StackFrame f = frames.remove(frames.size() - 1);
        if (f.kind == StackFrame.Kind.CALL) callDepth--;
    }

    /** Frames pushed above the global frame. */
    public int depth() {
        return frames.size();
    }

    public int callDepth() {
        return callDepth;
    }

    public int maxCallDepth() {
        return maxCallDepth;
    }

    public Environment innermost() {
        return frames.isEmpty() ? global.env : frames.get(frames.size() - 1).env;
    }

    public Environment globals() {
        return global.env;
    }

    public Environment base() {
        return base;
    }

    public boolean isInBase(String name) {
        return base != null && base.has(name);
    }

    /** Globals that code running now resolves against: the current callee's home, else this module's. */
    public Environment currentHome() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            StackFrame f = frames.get(i);
            if (f.kind == StackFrame.Kind.CALL) return (f.home == null) ? global.env : f.home;
        }
        return global.env;
    }

    /** Name of the innermost function being executed, or null at top level. */
    public String currentFunctionName() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            StackFrame f = frames.get(i);
            if (f.kind == StackFrame.Kind.CALL) return f.functionName;
        }
        return null;
    }

    // -------------------------
    // Names
    // -------------------------

    /** Environments reachable from the top frame, innermost first. The base is not included. */
    public List<Environment> visibleEnvironments() {
        List<Environment> out = new ArrayList<>();
        for (int i = frames.size() - 1; i >= 0; i--) {
            StackFrame f = frames.get(i);
            out.add(f.env);
            if (f.kind == StackFrame.Kind.CALL) {
                if (f.home != null) out.add(f.home);
                return out;
            }
        }
        out.add(global.env);
        return out;
    }

    /** @throws RuntimeError ALREADY_DECLARED */
    public void declare(String name, ValueCell cell) {
        innermost().declare(name, cell);
    }

    /** @return the visible cell for the name, or null */
    public ValueCell resolve(String name) {
        for (Environment env : visibleEnvironments()) {
            ValueCell c = env.lookup(name);
            if (c != null) return c;
        }
        return (base == null) ? null : base.lookup(name);
    }

    /** @throws RuntimeError UNDEFINED_VARIABLE */
    public Value lookup(String name) {
        ValueCell c = resolve(name);
        if (c == null) throw new RuntimeError(Diagnostic.undefinedVariable(name));
        return c.read();
    }

    /**
     * Assigns to the nearest visible binding.
     *
     * @throws RuntimeError REASSIGN_BUILTIN when only the base binds the name,
     *                      UNDEFINED_VARIABLE when nothing does
     */
    public void assign(String name, Value value) {
        for (Environment env : visibleEnvironments()) {
            if (env.has(name)) {
                env.assign(name, value);
                return;
            }
        }
        if (isInBase(name)) throw new RuntimeError(Diagnostic.reassignBuiltin(name));
        throw new RuntimeError(Diagnostic.undefinedVariable(name));
    }

    @Override
    public String toString() {
        return "Stack{global=" + global + ", frames=" + frames + "}";
    }
}
