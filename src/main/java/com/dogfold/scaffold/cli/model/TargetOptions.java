package com.dogfold.scaffold.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Target selection options of the generation commands.
 */
@Getter
public class TargetOptions {

    @Option(names = { "--target", "-t" }, paramLabel = "<name>", description = "Target package (name or alias)")
    private String target;

    @Option(names = { "--self" }, description = "Generate into the default target")
    private boolean self;

    /**
     * The explicit target if one was given, else {@code defaultTarget} for {@code --self}, else
     * {@code null}.
     */
    public String selector(String defaultTarget) {
        if (target != null) {
            return target;
        }
        return self ? defaultTarget : null;
    }
}
