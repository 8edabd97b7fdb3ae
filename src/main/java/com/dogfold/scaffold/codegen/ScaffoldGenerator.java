package com.dogfold.scaffold.codegen;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.ScaffoldException;
import com.dogfold.scaffold.codegen.generator.CliGenerator;
import com.dogfold.scaffold.codegen.generator.DomainGenerator;
import com.dogfold.scaffold.codegen.generator.DomainTemplateImporter;
import com.dogfold.scaffold.codegen.generator.PackageMarkerWriter;
import com.dogfold.scaffold.codegen.generator.PlainClassGenerator;
import com.dogfold.scaffold.codegen.generator.RegistryClassGenerator;
import com.dogfold.scaffold.codegen.generator.VerbGenerator;
import com.dogfold.scaffold.codegen.model.ClassDefinitionRequest;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.target.TargetResolver;
import com.dogfold.scaffold.codegen.template.BuiltinTemplateRenderer;
import com.dogfold.scaffold.codegen.template.TemplateEngine;

/**
 * Entry point of all generation flows.
 *
 * Every flow resolves its target first and reports its outcome as a {@link ScaffoldResult}.
 * Failures never escape: they are turned into {@link ResultStatus#ERROR} results.
 */
public class ScaffoldGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScaffoldGenerator.class);

    private final TargetResolver resolver;
    private final DomainGenerator domainGenerator;
    private final VerbGenerator verbGenerator;
    private final RegistryClassGenerator registryClassGenerator;
    private final PlainClassGenerator plainClassGenerator;
    private final CliGenerator cliGenerator;
    private final DomainTemplateImporter domainTemplateImporter;

    public ScaffoldGenerator(TargetResolver resolver, ScaffoldConfig config) {
        this(resolver, config, Clock.systemUTC());
    }

    public ScaffoldGenerator(TargetResolver resolver, ScaffoldConfig config, Clock clock) {
        this.resolver = resolver;
        TemplateEngine templateEngine = new TemplateEngine(config.strictPlaceholders());
        BuiltinTemplateRenderer builtinRenderer = new BuiltinTemplateRenderer();
        PackageMarkerWriter markerWriter = new PackageMarkerWriter(config);

        this.domainGenerator = new DomainGenerator(config, templateEngine, builtinRenderer, markerWriter);
        this.verbGenerator = new VerbGenerator(config, templateEngine, markerWriter);
        this.registryClassGenerator = new RegistryClassGenerator(config, builtinRenderer, markerWriter, clock);
        this.plainClassGenerator = new PlainClassGenerator(config, templateEngine, markerWriter);
        this.cliGenerator = new CliGenerator(config, templateEngine);
        this.domainTemplateImporter = new DomainTemplateImporter(markerWriter);
    }

    public ScaffoldResult registerDomain(String name, String targetSelector) {
        return run("registering domain '" + name + "'", targetSelector,
                target -> domainGenerator.generate(target, name));
    }

    /**
     * @param name {@code verb} or {@code domain.verb}
     * @param inlineCode accepted for compatibility, not injected into the generated file
     */
    public ScaffoldResult registerVerb(String name, String targetSelector, String inlineCode) {
        return run("registering verb '" + name + "'", targetSelector,
                target -> verbGenerator.generate(target, name, inlineCode));
    }

    public ScaffoldResult defineClass(ClassDefinitionRequest request) {
        String action = (request.isReverse() ? "removing" : "defining") + " class '" + request.getClassName() + "'";
        return run(action, request.getTarget(), target -> registryClassGenerator.generate(target, request));
    }

    public ScaffoldResult definePlainClass(String className, String domain, String inlineCode, String targetSelector) {
        return run("creating class '" + className + "'", targetSelector,
                target -> plainClassGenerator.generate(target, className, domain, inlineCode));
    }

    public ScaffoldResult registerCli(String name, String targetSelector) {
        return run("registering CLI '" + name + "'", targetSelector,
                target -> cliGenerator.generate(target, name));
    }

    public ScaffoldResult buildDomain(String name, String targetSelector) {
        return run("building domain '" + name + "'", targetSelector,
                target -> domainTemplateImporter.importDomain(target, name));
    }

    public TargetResolver getResolver() {
        return resolver;
    }

    private ScaffoldResult run(String action, String targetSelector, Flow flow) {
        try {
            Target target = resolver.resolve(targetSelector);
            log.debug("{} in target {} ({})", action, target.getKey(), target.getRoot());
            return flow.apply(target);
        } catch (ScaffoldException e) {
            log.debug("{} failed: {}", action, e.getKind());
            return ScaffoldResult.failure(e.getMessage());
        } catch (IOException | UncheckedIOException e) {
            log.debug("I/O failure while {}", action, e);
            return ScaffoldResult.failure("Error " + action + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    private interface Flow {
        ScaffoldResult apply(Target target) throws IOException;
    }
}
