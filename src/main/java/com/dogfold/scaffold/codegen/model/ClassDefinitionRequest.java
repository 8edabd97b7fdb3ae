package com.dogfold.scaffold.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Input of the registry-backed class flow.
 */
@Value
@Builder(toBuilder = true)
public class ClassDefinitionRequest {

    @NonNull
    String className;

    /**
     * Domain to nest the class under, or {@code null} for the target root.
     */
    String domain;

    /**
     * Version of the class and its registry; the configured default when {@code null}.
     */
    String version;

    /**
     * Removes the class directory instead of creating it.
     */
    boolean reverse;

    /**
     * Target selector, {@code null} for the default target.
     */
    String target;
}
