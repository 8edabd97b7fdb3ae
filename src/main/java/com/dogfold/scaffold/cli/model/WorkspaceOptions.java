package com.dogfold.scaffold.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options shared by every command: where the repository is, where its configuration lives and
 * how much to log. No validation, no execution logic.
 */
@Getter
public class WorkspaceOptions {

    @Option(names = { "--repo-root" }, description = "Repository root (defaults to the current directory)")
    private Path repoRoot;

    @Option(names = { "--config" }, description = "Configuration file (defaults to <repo-root>/dogfold.yml)")
    private Path configFile;

    @Option(names = { "-v", "--verbose" }, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;
}
