package com.dogfold.scaffold.codegen.exception;

/**
 * Base class for generation failures that are reported to the user as an error outcome.
 */
public abstract class ScaffoldException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected ScaffoldException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public enum ErrorKind {
        UNKNOWN_TARGET,
        TEMPLATE_NOT_FOUND,
        INVALID_NAME,
        UNKNOWN_PLACEHOLDER
    }
}
