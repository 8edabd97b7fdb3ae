package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(
        name = "cli",
        mixinStandardHelpOptions = true,
        description = "Creates a command line entry point from templates/clis/<name>_cli_template."
)
public class RegisterCliCommand extends AbstractScaffoldCommand {

    @Mixin
    private TargetOptions targetOptions;

    @Parameters(index = "0", paramLabel = "<name>", description = "CLI name")
    private String name;

    @Override
    protected int execute(ScaffoldGenerator generator) {
        return report(generator.registerCli(name, targetSelector(generator, targetOptions)));
    }
}
