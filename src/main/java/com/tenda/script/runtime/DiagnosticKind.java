package com.tenda.script.runtime;

public enum DiagnosticKind {
    ALREADY_DECLARED("already_declared"),
    UNDEFINED_VARIABLE("undefined_variable"),
    TYPE_MISMATCH("type_mismatch"),
    ARITY_MISMATCH("arity_mismatch"),
    DIVISION_BY_ZERO("division_by_zero"),
    USER_RAISED("user_raised"),
    STACK_OVERFLOW("stack_overflow", true),
    INDEX_OUT_OF_BOUNDS("index_out_of_bounds"),
    INVALID_INDEX("invalid_index"),
    INVALID_RANGE_BOUNDS("invalid_range_bounds"),
    INVALID_MAP_KEY("invalid_map_key"),
    KEY_NOT_FOUND("key_not_found"),
    NOT_ITERABLE("not_iterable"),
    IMMUTABLE_STRING("immutable_string"),
    REASSIGN_BUILTIN("reassign_builtin"),
    INVALID_ARGUMENT("invalid_argument"),
    MODULE_NOT_FOUND("module_not_found"),
    IMPORT_CYCLE("import_cycle"),
    NOT_EXPORTED("not_exported");

    public final String code;
    /** Fatal kinds cannot be handled by {@code tente}; they end the execution. */
    public final boolean fatal;

    DiagnosticKind(String code) {
        this(code, false);
    }

    DiagnosticKind(String code, boolean fatal) {
        this.code = code;
        this.fatal = fatal;
    }

    public static DiagnosticKind fromCode(String code) {
        for (DiagnosticKind k : values()) {
            if (k.code.equals(code) || k.name().equals(code)) return k;
        }
        throw new IllegalArgumentException("Unknown diagnostic kind: " + code);
    }
}
