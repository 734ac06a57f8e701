package com.tenda.script.runtime;

/** Host hook notified of the diagnostic that ended an execution. */
@FunctionalInterface
public interface DiagnosticListener {
    void onDiagnostic(String moduleId, Diagnostic diagnostic);
}
