package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.model.VerbName;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.template.Placeholder;
import com.dogfold.scaffold.codegen.template.TemplateEngine;
import com.dogfold.scaffold.codegen.template.TemplateKind;
import com.dogfold.scaffold.codegen.template.TemplateReference;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;

/**
 * Creates a verb file from the most specific template available:
 * <ol>
 *   <li>{@code templates/domains/<domain>/verbs/<verb>} (domain verbs only)</li>
 *   <li>{@code templates/verbs/<verb>}</li>
 *   <li>{@code templates/verbs/verb_template}</li>
 * </ol>
 */
public class VerbGenerator {

    private static final Logger log = LoggerFactory.getLogger(VerbGenerator.class);

    static final String GENERIC_TEMPLATE = "verb_template";

    private final ScaffoldConfig config;
    private final TemplateEngine templateEngine;
    private final PackageMarkerWriter markerWriter;

    public VerbGenerator(ScaffoldConfig config, TemplateEngine templateEngine, PackageMarkerWriter markerWriter) {
        this.config = config;
        this.templateEngine = templateEngine;
        this.markerWriter = markerWriter;
    }

    public ScaffoldResult generate(Target target, String fullName, String inlineCode) throws IOException {
        VerbName name = VerbName.parse(fullName);

        Path verbsDir = verbsDirOf(target, name);
        Path verbFile = verbsDir.resolve(name.getVerb() + config.artifactExtension());
        if (Files.exists(verbFile)) {
            markerWriter.ensure(target, verbsDir, null);
            return alreadyExists(name, verbFile);
        }

        TemplateReference reference = templateEngine.locate(candidates(target, name));
        if (reference.isFallback()) {
            log.debug("No specific template for verb '{}', using {}", name, reference.getPath());
        }
        String content = templateEngine.render(TemplateKind.VERB, reference, bindings(name));

        markerWriter.ensure(target, verbsDir, null);
        if (!FileWriteUtil.writeIfAbsent(verbFile, content)) {
            return alreadyExists(name, verbFile);
        }

        ScaffoldResult.ScaffoldResultBuilder result = ScaffoldResult.builder()
                .status(ResultStatus.SUCCESS)
                .message("Registered verb '" + name.qualifiedName() + "' in " + target.getPackageName() + " -> " + verbFile)
                .path(verbFile);
        if (inlineCode != null && !inlineCode.isBlank()) {
            log.warn("Inline code for verb '{}' is not supported yet and was ignored", name);
            result.note("Inline code is not supported yet; the template body was used unchanged");
        }
        return result.build();
    }

    Path verbsDirOf(Target target, VerbName name) {
        return name.hasDomain()
                ? target.getRoot().resolve("domains").resolve(name.getDomain()).resolve("verbs")
                : target.getRoot().resolve("verbs");
    }

    private Path[] candidates(Target target, VerbName name) {
        String ext = config.artifactExtension();
        Path templates = target.getTemplates();
        Path generic = templates.resolve("verbs").resolve(GENERIC_TEMPLATE + ext);
        Path topLevel = templates.resolve("verbs").resolve(name.getVerb() + ext);
        if (name.hasDomain()) {
            Path domainSpecific = templates.resolve("domains").resolve(name.getDomain())
                    .resolve("verbs").resolve(name.getVerb() + ext);
            return new Path[] {domainSpecific, topLevel, generic};
        }
        return new Path[] {topLevel, generic};
    }

    private Map<Placeholder, String> bindings(VerbName name) {
        Map<Placeholder, String> bindings = new EnumMap<>(Placeholder.class);
        bindings.put(Placeholder.VERB_NAME, name.getVerb());
        bindings.put(Placeholder.VERB_TYPE_NAME, name.typeName());
        if (name.hasDomain()) {
            bindings.put(Placeholder.DOMAIN_NAME, name.getDomain());
        }
        return bindings;
    }

    private ScaffoldResult alreadyExists(VerbName name, Path verbFile) {
        return ScaffoldResult.alreadyExists(
                "Verb '" + name.qualifiedName() + "' already exists, not overwriting: " + verbFile, verbFile);
    }
}
