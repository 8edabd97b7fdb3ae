package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.template.Placeholder;
import com.dogfold.scaffold.codegen.template.TemplateEngine;
import com.dogfold.scaffold.codegen.template.TemplateKind;
import com.dogfold.scaffold.codegen.template.TemplateReference;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;
import com.dogfold.scaffold.codegen.util.NamingUtil;

/**
 * Creates a single class file, either from inline content or from the class templates.
 */
public class PlainClassGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlainClassGenerator.class);

    static final String GENERIC_TEMPLATE = "class_template";

    private final ScaffoldConfig config;
    private final TemplateEngine templateEngine;
    private final PackageMarkerWriter markerWriter;

    public PlainClassGenerator(ScaffoldConfig config, TemplateEngine templateEngine, PackageMarkerWriter markerWriter) {
        this.config = config;
        this.templateEngine = templateEngine;
        this.markerWriter = markerWriter;
    }

    public ScaffoldResult generate(Target target, String className, String domain, String inlineCode)
            throws IOException {
        NamingUtil.requireSimpleName("Class", className);
        if (domain != null) {
            NamingUtil.requireSimpleName("Domain", domain);
        }
        String stem = NamingUtil.toSnakeCase(className);

        Path classesDir = domain == null
                ? target.getRoot()
                : target.getRoot().resolve("domains").resolve(domain).resolve("classes");
        Path classFile = classesDir.resolve(stem + config.artifactExtension());
        if (Files.exists(classFile)) {
            return alreadyExists(className, classFile);
        }

        String content;
        if (inlineCode != null && !inlineCode.isEmpty()) {
            content = inlineCode.endsWith("\n") ? inlineCode : inlineCode + "\n";
        } else {
            TemplateReference reference = templateEngine.locate(candidates(target, stem, domain));
            content = templateEngine.render(TemplateKind.CLASS, reference, bindings(className, domain));
        }

        if (domain != null) {
            markerWriter.ensure(target, classesDir, null);
        }
        if (!FileWriteUtil.writeIfAbsent(classFile, content)) {
            return alreadyExists(className, classFile);
        }
        log.debug("Created class file {}", classFile);
        return ScaffoldResult.success(
                "Created class '" + className + "' in " + target.getPackageName() + " -> " + classFile, classFile);
    }

    private Path[] candidates(Target target, String stem, String domain) {
        String ext = config.artifactExtension();
        Path templates = target.getTemplates();
        Path specificDir = domain == null
                ? templates.resolve("classes")
                : templates.resolve("domains").resolve(domain).resolve("classes");
        return new Path[] {specificDir.resolve(stem + ext), templates.resolve(GENERIC_TEMPLATE + ext)};
    }

    private Map<Placeholder, String> bindings(String className, String domain) {
        Map<Placeholder, String> bindings = new EnumMap<>(Placeholder.class);
        bindings.put(Placeholder.CLASS_NAME, className);
        if (domain != null) {
            bindings.put(Placeholder.DOMAIN_NAME, domain);
        }
        return bindings;
    }

    private ScaffoldResult alreadyExists(String className, Path classFile) {
        return ScaffoldResult.alreadyExists(
                "Class '" + className + "' already exists, not overwriting: " + classFile, classFile);
    }
}
