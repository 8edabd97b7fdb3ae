package com.dogfold.scaffold.codegen.exception;

/**
 * Raised for malformed artifact names, such as a dotted verb name with an empty segment.
 */
public class InvalidNameException extends ScaffoldException {

    private static final long serialVersionUID = 1L;

    public InvalidNameException(String message) {
        super(ErrorKind.INVALID_NAME, message);
    }
}
