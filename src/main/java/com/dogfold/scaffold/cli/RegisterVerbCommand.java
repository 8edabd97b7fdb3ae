package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(
        name = "verb",
        mixinStandardHelpOptions = true,
        description = "Creates a verb from the most specific verb template."
)
public class RegisterVerbCommand extends AbstractScaffoldCommand {

    @Mixin
    private TargetOptions targetOptions;

    @Parameters(index = "0", paramLabel = "<name>", description = "Verb name, or domain.verb for a domain verb")
    private String name;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<inline>",
            description = "Inline code (accepted, not injected yet)")
    private String inlineCode;

    @Override
    protected int execute(ScaffoldGenerator generator) {
        return report(generator.registerVerb(name,
                targetSelector(generator, targetOptions), inlineCode));
    }
}
