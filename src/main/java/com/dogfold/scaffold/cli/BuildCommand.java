package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Builds a domain from templates/domains/<domain>, skipping files that already exist."
)
public class BuildCommand extends AbstractScaffoldCommand {

    @Mixin
    private TargetOptions targetOptions;

    @Parameters(index = "0", paramLabel = "<domain>", description = "Domain name")
    private String domain;

    @Override
    protected int execute(ScaffoldGenerator generator) {
        return report(generator.buildDomain(domain, targetSelector(generator, targetOptions)));
    }
}
