package com.dogfold.scaffold;

import com.dogfold.scaffold.cli.DogCommand;
import picocli.CommandLine;

/**
 * Main entry point of the {@code dog} scaffolding tool.
 */
public class ScaffoldApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DogCommand()).execute(args);
        System.exit(exitCode);
    }
}
