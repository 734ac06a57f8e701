package com.tenda.script.json;

/** A JSON document that does not describe a valid syntax tree. */
public class AstFormatException extends RuntimeException {

    private final String path;

    public AstFormatException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public AstFormatException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /** JSON-pointer-like location of the offending node, e.g. {@code /statements/2/value}. */
    public String getPath() {
        return path;
    }
}
