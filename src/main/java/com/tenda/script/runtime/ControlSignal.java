package com.tenda.script.runtime;

/**
 * Outcome of executing one statement. Every non-NORMAL signal stops the
 * enclosing statement list and is handed up to whoever can consume it: a loop
 * (BREAK, CONTINUE), a call (RETURN), a {@code tente} (non-fatal RAISED), or
 * the program itself.
 */
public final class ControlSignal {
    public enum Kind { NORMAL, RETURN, BREAK, CONTINUE, RAISED }

    private static final ControlSignal NORMAL = new ControlSignal(Kind.NORMAL, null, null);
    private static final ControlSignal BREAK = new ControlSignal(Kind.BREAK, null, null);
    private static final ControlSignal CONTINUE = new ControlSignal(Kind.CONTINUE, null, null);

    public final Kind kind;
    /** RETURN: the returned value. NORMAL: the completion value of an expression statement, or null. */
    public final Value value;
    public final Diagnostic diagnostic;

    private ControlSignal(Kind kind, Value value, Diagnostic diagnostic) {
        this.kind = kind;
        this.value = value;
        this.diagnostic = diagnostic;
    }

    public static ControlSignal normal() { return NORMAL; }

    public static ControlSignal normal(Value completion) {
        return (completion == null) ? NORMAL : new ControlSignal(Kind.NORMAL, completion, null);
    }

    public static ControlSignal ret(Value v) {
        return new ControlSignal(Kind.RETURN, (v == null) ? Value.nil() : v, null);
    }

    public static ControlSignal breakLoop() { return BREAK; }

    public static ControlSignal continueLoop() { return CONTINUE; }

    public static ControlSignal raised(Diagnostic d) {
        if (d == null) throw new IllegalArgumentException("diagnostic");
        return new ControlSignal(Kind.RAISED, null, d);
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    public boolean isRaised() {
        return kind == Kind.RAISED;
    }

    @Override
    public String toString() {
        switch (kind) {
            case RETURN:
                return "Return(" + value.repr() + ")";
            case RAISED:
                return "Raised(" + diagnostic + ")";
            default:
                return kind.name();
        }
    }
}
