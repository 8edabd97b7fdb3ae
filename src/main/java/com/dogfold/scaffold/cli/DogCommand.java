package com.dogfold.scaffold.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code register domain|verb|cli <name>}</li>
 *   <li>{@code define <ClassName>} - registry-backed class</li>
 *   <li>{@code class <ClassName>} - single class file</li>
 *   <li>{@code build <domain>} - domain from prepared templates</li>
 *   <li>{@code targets}</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * dog register domain billing
 * dog register verb billing.invoice --target life-cli
 * dog define Invoice --domain billing --version 2.0.0
 * }</pre>
 */
@Command(
        name = "dog",
        mixinStandardHelpOptions = true,
        version = "dogfold-scaffold 0.1.0",
        description = "Scaffolds domains, verbs and registry-backed classes into a target package.",
        subcommands = {
                RegisterCommand.class,
                DefineCommand.class,
                ClassCommand.class,
                BuildCommand.class,
                TargetsCommand.class
        }
)
public class DogCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
