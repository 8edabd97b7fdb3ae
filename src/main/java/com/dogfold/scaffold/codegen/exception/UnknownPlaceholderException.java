package com.dogfold.scaffold.codegen.exception;

import java.nio.file.Path;
import java.util.Set;

/**
 * Raised in strict mode when rendered template text still contains placeholder-shaped tokens
 * that are not allowed for the template kind.
 */
public class UnknownPlaceholderException extends ScaffoldException {

    private static final long serialVersionUID = 1L;

    public UnknownPlaceholderException(Path template, Set<String> tokens) {
        super(ErrorKind.UNKNOWN_PLACEHOLDER, "Unknown placeholder(s) " + tokens + " in template " + template);
    }
}
