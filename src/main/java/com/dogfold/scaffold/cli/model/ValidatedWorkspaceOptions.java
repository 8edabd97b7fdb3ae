package com.dogfold.scaffold.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the commands. Keeps the commands thin.
 */
@Data
@AllArgsConstructor
public class ValidatedWorkspaceOptions {
    Path repoRoot;
    Path configFile;
    boolean verbose;
}
