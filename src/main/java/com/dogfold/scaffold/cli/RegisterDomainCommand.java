package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(
        name = "domain",
        mixinStandardHelpOptions = true,
        description = "Creates domains/<name> with classes/ and verbs/ and a command stub."
)
public class RegisterDomainCommand extends AbstractScaffoldCommand {

    @Mixin
    private TargetOptions targetOptions;

    @Parameters(index = "0", paramLabel = "<name>", description = "Domain name")
    private String name;

    @Override
    protected int execute(ScaffoldGenerator generator) {
        return report(generator.registerDomain(name, targetSelector(generator, targetOptions)));
    }
}
