package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.template.BuiltinTemplateRenderer;
import com.dogfold.scaffold.codegen.template.Placeholder;
import com.dogfold.scaffold.codegen.template.TemplateEngine;
import com.dogfold.scaffold.codegen.template.TemplateKind;
import com.dogfold.scaffold.codegen.template.TemplateReference;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;
import com.dogfold.scaffold.codegen.util.NamingUtil;

/**
 * Creates a domain: {@code domains/<name>/{classes,verbs}} with package markers and a command
 * stub. Re-running it only fills in what is missing.
 */
public class DomainGenerator {

    private static final Logger log = LoggerFactory.getLogger(DomainGenerator.class);

    static final String COMMANDS_TEMPLATE = "domain_commands_template";

    private final ScaffoldConfig config;
    private final TemplateEngine templateEngine;
    private final BuiltinTemplateRenderer builtinRenderer;
    private final PackageMarkerWriter markerWriter;

    public DomainGenerator(ScaffoldConfig config, TemplateEngine templateEngine,
                           BuiltinTemplateRenderer builtinRenderer, PackageMarkerWriter markerWriter) {
        this.config = config;
        this.templateEngine = templateEngine;
        this.builtinRenderer = builtinRenderer;
        this.markerWriter = markerWriter;
    }

    public ScaffoldResult generate(Target target, String name) throws IOException {
        NamingUtil.requireSimpleName("Domain", name);

        Path domainsRoot = target.getRoot().resolve("domains");
        Path domainRoot = domainsRoot.resolve(name);
        boolean domainExisted = Files.isDirectory(domainRoot);
        int created = 0;

        if (!Files.isDirectory(domainsRoot)
                && markerWriter.ensure(target, domainsRoot, NamingUtil.toPackageSegment(target.getPackageName()) + " domains")) {
            created++;
        }

        created += markerWriter.ensure(target, domainRoot, name + " domain") ? 1 : 0;
        created += markerWriter.ensure(target, domainRoot.resolve("classes"), null) ? 1 : 0;
        created += markerWriter.ensure(target, domainRoot.resolve("verbs"), null) ? 1 : 0;

        Path commandsFile = commandsFileOf(domainRoot, name);
        if (!Files.exists(commandsFile)
                && FileWriteUtil.writeIfAbsent(commandsFile, commandsContent(target, domainRoot, name))) {
            log.debug("Created domain commands {}", commandsFile);
            created++;
        }

        if (domainExisted && created == 0) {
            return ScaffoldResult.alreadyExists(
                    "Domain '" + name + "' already exists in " + target.getPackageName() + ", nothing to add: " + domainRoot,
                    domainRoot);
        }
        ScaffoldResult.ScaffoldResultBuilder result = ScaffoldResult.builder()
                .status(ResultStatus.SUCCESS)
                .message("Registered domain '" + name + "' in " + target.getPackageName() + " -> " + domainRoot)
                .path(domainRoot);
        if (domainExisted) {
            result.note("Filled in " + created + " missing file(s)");
        }
        return result.build();
    }

    Path commandsFileOf(Path domainRoot, String name) {
        return domainRoot.resolve(NamingUtil.toTypeName(name) + "Commands" + config.artifactExtension());
    }

    private String commandsContent(Target target, Path domainRoot, String name) throws IOException {
        Path templateFile = target.getTemplates().resolve(COMMANDS_TEMPLATE + config.artifactExtension());
        if (Files.isRegularFile(templateFile)) {
            TemplateReference reference = templateEngine.locate(templateFile);
            return templateEngine.render(TemplateKind.DOMAIN_COMMANDS, reference,
                    Map.of(Placeholder.DOMAIN_NAME, name));
        }

        log.debug("No domain commands template at {}, using the builtin stub", templateFile);
        Map<String, Object> model = new HashMap<>();
        model.put("packageName", target.javaPackageOf(domainRoot));
        model.put("domainName", name);
        model.put("typeName", NamingUtil.toTypeName(name) + "Commands");
        return builtinRenderer.render(BuiltinTemplateRenderer.DOMAIN_COMMANDS, model);
    }
}
