package com.tenda.script.runtime;

import com.tenda.script.ast.SourceSpan;

/** One call a diagnostic unwound through. */
public final class TraceEntry {
    public static final String ANONYMOUS = "<anônima>";

    public final String functionName;
    public final SourceSpan callSite; // may be null

    public TraceEntry(String functionName, SourceSpan callSite) {
        this.functionName = (functionName == null) ? ANONYMOUS : functionName;
        this.callSite = callSite;
    }

    @Override
    public String toString() {
        return functionName + (callSite == null ? "" : " @ " + callSite);
    }
}
