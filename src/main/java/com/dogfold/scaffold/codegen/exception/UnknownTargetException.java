package com.dogfold.scaffold.codegen.exception;

import java.util.Collection;

/**
 * Raised when a target selector does not resolve to a discovered target.
 */
public class UnknownTargetException extends ScaffoldException {

    private static final long serialVersionUID = 1L;

    public UnknownTargetException(String requested, Collection<String> knownTargets) {
        super(ErrorKind.UNKNOWN_TARGET, "Unknown target '" + requested + "'. Known targets: "
                + (knownTargets.isEmpty() ? "<none>" : String.join(", ", knownTargets)));
    }
}
