package com.tenda.script.runtime;

/**
 * Carries a {@link Diagnostic} out of expression evaluation. The statement
 * executor turns it back into {@link ControlSignal#raised(Diagnostic)}; it never
 * escapes {@link Interpreter#run}.
 */
public class RuntimeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public final Diagnostic diagnostic;

    public RuntimeError(Diagnostic diagnostic) {
        super(null, null, false, false);
        this.diagnostic = diagnostic;
    }

    @Override
    public String getMessage() {
        return diagnostic.toString();
    }
}
