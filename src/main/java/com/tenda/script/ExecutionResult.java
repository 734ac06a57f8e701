package com.tenda.script;

import java.util.Collections;
import java.util.Map;

import com.tenda.script.runtime.Diagnostic;
import com.tenda.script.runtime.Value;

/**
 * What a run handed back to the host: either the program's final value or the
 * diagnostic that ended it, plus the top-level bindings as they were left.
 */
public final class ExecutionResult {

    private final String moduleId;
    private final Value value;
    private final Diagnostic diagnostic;
    private final Map<String, Value> globals;

    private ExecutionResult(String moduleId, Value value, Diagnostic diagnostic, Map<String, Value> globals) {
        this.moduleId = moduleId;
        this.value = value;
        this.diagnostic = diagnostic;
        this.globals = Collections.unmodifiableMap(globals);
    }

    static ExecutionResult completed(String moduleId, Value value, Map<String, Value> globals) {
        return new ExecutionResult(moduleId, (value == null) ? Value.nil() : value, null, globals);
    }

    static ExecutionResult failed(String moduleId, Diagnostic diagnostic, Map<String, Value> globals) {
        return new ExecutionResult(moduleId, null, diagnostic, globals);
    }

    public boolean isSuccess() {
        return diagnostic == null;
    }

    public String moduleId() {
        return moduleId;
    }

    /** The returned value, or the last expression statement's; Nada on failure. */
    public Value value() {
        return (value == null) ? Value.nil() : value;
    }

    /** @return null on success */
    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public Map<String, Value> globals() {
        return globals;
    }

    /** @throws IllegalStateException when the run failed */
    public Value valueOrThrow() {
        if (diagnostic != null) throw new IllegalStateException("Execution failed: " + diagnostic);
        return value();
    }

    @Override
    public String toString() {
        return isSuccess() ? "Completed(" + value().repr() + ")" : "Failed(" + diagnostic + ")";
    }
}
