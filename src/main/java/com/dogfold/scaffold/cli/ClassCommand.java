package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "class",
        mixinStandardHelpOptions = true,
        description = "Creates a single class file from inline code or the class templates."
)
public class ClassCommand extends AbstractScaffoldCommand {

    @Mixin
    private TargetOptions targetOptions;

    @Parameters(index = "0", paramLabel = "<ClassName>", description = "Class name")
    private String className;

    @Option(names = { "--domain", "-d" }, description = "Domain to create the class in")
    private String domain;

    @Option(names = { "--code" }, paramLabel = "<inline>", description = "File content to write instead of a template")
    private String inlineCode;

    @Override
    protected int execute(ScaffoldGenerator generator) {
        return report(generator.definePlainClass(className, domain, inlineCode,
                targetSelector(generator, targetOptions)));
    }
}
