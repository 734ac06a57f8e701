package com.tenda.script.ast;

/**
 * One declared parameter. {@code captured} is filled in by {@link CaptureAnalyzer}
 * when a nested function refers to the parameter.
 */
public final class FunctionParam {
    public final String name;
    public final Expr.ExprInterface defaultValue; // may be null
    public final boolean variadic;
    public final SourceSpan span;
    public boolean captured;

    public FunctionParam(String name, Expr.ExprInterface defaultValue, boolean variadic, SourceSpan span) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Parameter name is required");
        if (variadic && defaultValue != null) {
            throw new IllegalArgumentException("Variadic parameter cannot have a default: " + name);
        }
        this.name = name;
        this.defaultValue = defaultValue;
        this.variadic = variadic;
        this.span = span;
    }

    public FunctionParam(String name) {
        this(name, null, false, null);
    }

    public boolean isRequired() {
        return defaultValue == null && !variadic;
    }

    @Override
    public String toString() {
        return (variadic ? "..." : "") + name + (defaultValue != null ? " = ..." : "");
    }
}
