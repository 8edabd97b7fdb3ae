package com.dogfold.scaffold.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Groups the {@code register} flows. Without a subcommand it prints usage.
 */
@Command(
        name = "register",
        mixinStandardHelpOptions = true,
        description = "Registers a domain, a verb or a CLI.",
        subcommands = {
                RegisterDomainCommand.class,
                RegisterVerbCommand.class,
                RegisterCliCommand.class
        }
)
public class RegisterCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
