package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.TemplateNotFoundException;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.template.TemplateEngine;
import com.dogfold.scaffold.codegen.template.TemplateKind;
import com.dogfold.scaffold.codegen.template.TemplateReference;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;
import com.dogfold.scaffold.codegen.util.NamingUtil;

/**
 * Creates a command line entry point from {@code templates/clis/<name>_cli_template}.
 */
public class CliGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliGenerator.class);

    static final String TEMPLATE_SUFFIX = "_cli_template";

    private final ScaffoldConfig config;
    private final TemplateEngine templateEngine;

    public CliGenerator(ScaffoldConfig config, TemplateEngine templateEngine) {
        this.config = config;
        this.templateEngine = templateEngine;
    }

    public ScaffoldResult generate(Target target, String name) throws IOException {
        NamingUtil.requireSimpleName("CLI", name);

        Path cliFile = target.getRoot().resolve(NamingUtil.toTypeName(name) + "Cli" + config.artifactExtension());
        if (Files.exists(cliFile)) {
            return alreadyExists(name, cliFile);
        }

        Path clisDir = target.getTemplates().resolve("clis");
        Path templateFile = clisDir.resolve(name + TEMPLATE_SUFFIX + config.artifactExtension());
        if (!Files.isRegularFile(templateFile)) {
            List<String> available = availableClis(clisDir);
            throw new TemplateNotFoundException(templateFile, "No CLI template for '" + name + "' at " + templateFile
                    + ". Available: " + (available.isEmpty() ? "<none>" : String.join(", ", available)));
        }

        TemplateReference reference = templateEngine.locate(templateFile);
        String content = templateEngine.render(TemplateKind.CLI, reference, Map.of());
        if (!FileWriteUtil.writeIfAbsent(cliFile, content)) {
            return alreadyExists(name, cliFile);
        }
        log.debug("Created CLI {} from {}", cliFile, templateFile);
        return ScaffoldResult.success(
                "Registered CLI '" + name + "' in " + target.getPackageName() + " -> " + cliFile, cliFile);
    }

    /**
     * Names of the CLIs that have a template, in name order.
     */
    List<String> availableClis(Path clisDir) throws IOException {
        if (!Files.isDirectory(clisDir)) {
            return List.of();
        }
        String suffix = TEMPLATE_SUFFIX + config.artifactExtension();
        try (Stream<Path> files = Files.list(clisDir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(suffix) && n.length() > suffix.length())
                    .map(n -> n.substring(0, n.length() - suffix.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private ScaffoldResult alreadyExists(String name, Path cliFile) {
        return ScaffoldResult.alreadyExists("CLI '" + name + "' already exists, not overwriting: " + cliFile, cliFile);
    }
}
