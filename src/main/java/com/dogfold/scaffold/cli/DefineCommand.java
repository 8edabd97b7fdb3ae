package com.dogfold.scaffold.cli;

import com.dogfold.scaffold.cli.model.TargetOptions;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;
import com.dogfold.scaffold.codegen.model.ClassDefinitionRequest;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Defines a registry-backed class, or removes it with {@code --reverse}.
 *
 * <p>{@code --version} is the class version here, so the standard help mixin is not used.
 */
@Command(
        name = "define",
        description = "Creates <snake_name>/ with the class module and its YAML registry."
)
public class DefineCommand extends AbstractScaffoldCommand {

    @Mixin
    private TargetOptions targetOptions;

    @Option(names = { "-h", "--help" }, usageHelp = true, description = "Show this help message and exit.")
    private boolean helpRequested;

    @Parameters(index = "0", paramLabel = "<ClassName>", description = "Class name")
    private String className;

    @Option(names = { "--domain", "-d" }, description = "Domain to create the class in")
    private String domain;

    @Option(names = { "--version" }, paramLabel = "<x.y.z>", description = "Class and registry version (default: 1.0.0)")
    private String version;

    @Option(names = { "--reverse" }, description = "Remove the class directory instead of creating it")
    private boolean reverse;

    @Override
    protected int execute(ScaffoldGenerator generator) {
        return report(generator.defineClass(ClassDefinitionRequest.builder()
                .className(className)
                .domain(domain)
                .version(version)
                .reverse(reverse)
                .target(targetSelector(generator, targetOptions))
                .build()));
    }
}
