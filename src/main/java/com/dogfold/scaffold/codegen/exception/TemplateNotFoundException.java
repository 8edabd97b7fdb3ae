package com.dogfold.scaffold.codegen.exception;

import java.nio.file.Path;

/**
 * Raised when no template exists at any precedence level.
 */
public class TemplateNotFoundException extends ScaffoldException {

    private static final long serialVersionUID = 1L;

    private final transient Path lastProbed;

    public TemplateNotFoundException(Path lastProbed) {
        this(lastProbed, "Template file not found: " + lastProbed);
    }

    public TemplateNotFoundException(Path lastProbed, String message) {
        super(ErrorKind.TEMPLATE_NOT_FOUND, message);
        this.lastProbed = lastProbed;
    }

    public Path getLastProbed() {
        return lastProbed;
    }
}
