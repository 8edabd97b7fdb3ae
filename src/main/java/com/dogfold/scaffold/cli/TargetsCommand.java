package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.codegen.ScaffoldGenerator;

import picocli.CommandLine.Command;

/**
 * Lists the targets discovered in the repository.
 */
@Command(
        name = "targets",
        mixinStandardHelpOptions = true,
        description = "Lists known targets and their roots."
)
public class TargetsCommand extends AbstractScaffoldCommand {

    @Override
    protected int execute(ScaffoldGenerator generator) {
        printer.printTargets(generator.getResolver());
        return 0;
    }
}
