package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.InvalidNameException;
import com.dogfold.scaffold.codegen.model.ClassDefinitionRequest;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.template.BuiltinTemplateRenderer;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;
import com.dogfold.scaffold.codegen.util.NamingUtil;
import com.dogfold.scaffold.registry.ClassRegistry;

/**
 * Defines a registry-backed class: a {@code <snake_name>} directory holding the class module and
 * its registry document, or removes that directory again in reverse mode.
 *
 * The module and the registry document are written together: if the document cannot be written
 * the module written by the same call is removed.
 */
public class RegistryClassGenerator {

    private static final Logger log = LoggerFactory.getLogger(RegistryClassGenerator.class);

    /** Directory names the other flows own inside a target. */
    static final Set<String> MANAGED_DIRS = Set.of("domains", "verbs", "schemas", "classes");

    /** Names of the types nested in the generated module. */
    static final Set<String> NESTED_TYPE_NAMES = Set.of("Registry", "Document");

    private final ScaffoldConfig config;
    private final BuiltinTemplateRenderer builtinRenderer;
    private final PackageMarkerWriter markerWriter;
    private final Clock clock;

    public RegistryClassGenerator(ScaffoldConfig config, BuiltinTemplateRenderer builtinRenderer,
                                  PackageMarkerWriter markerWriter, Clock clock) {
        this.config = config;
        this.builtinRenderer = builtinRenderer;
        this.markerWriter = markerWriter;
        this.clock = clock;
    }

    public ScaffoldResult generate(Target target, ClassDefinitionRequest request) throws IOException {
        String className = NamingUtil.requireSimpleName("Class", request.getClassName());
        if (request.getDomain() != null) {
            NamingUtil.requireSimpleName("Domain", request.getDomain());
        }
        requireFreeClassName(target, className);
        Path classDir = classDirOf(target, className, request.getDomain());

        if (request.isReverse()) {
            return remove(target, className, classDir);
        }
        String version = request.getVersion() == null || request.getVersion().isBlank()
                ? config.defaultClassVersion()
                : request.getVersion();
        return create(target, className, version, classDir);
    }

    /**
     * {@code <root>/<snake_name>} or {@code <root>/domains/<domain>/classes/<snake_name>}.
     */
    public Path classDirOf(Target target, String className, String domain) {
        String dirName = NamingUtil.toSnakeCase(className);
        if (domain == null) {
            return target.getRoot().resolve(dirName);
        }
        return target.getRoot().resolve("domains").resolve(domain).resolve("classes").resolve(dirName);
    }

    public static Path moduleFileOf(Path classDir, String className) {
        return classDir.resolve(className + ".java");
    }

    public static Path registryFileOf(Path classDir, String className) {
        return classDir.resolve(NamingUtil.toSnakeCase(className) + "_registry.yml");
    }

    private void requireFreeClassName(Target target, String className) {
        if (NESTED_TYPE_NAMES.contains(className)) {
            throw new InvalidNameException("Invalid class name: " + className
                    + " (reserved for the types nested in the generated module)");
        }
        Set<String> reserved = new HashSet<>(MANAGED_DIRS);
        Path templates = target.getTemplates();
        if (templates != null && target.getRoot().equals(templates.getParent())) {
            reserved.add(templates.getFileName().toString());
        }
        String dirName = NamingUtil.toSnakeCase(className);
        if (reserved.contains(dirName)) {
            throw new InvalidNameException("Invalid class name: " + className
                    + " (directory '" + dirName + "' is managed by the scaffolder)");
        }
    }

    private ScaffoldResult remove(Target target, String className, Path classDir) throws IOException {
        if (!Files.exists(moduleFileOf(classDir, className)) && !Files.exists(registryFileOf(classDir, className))) {
            return ScaffoldResult.alreadyExists("No class '" + className + "' to remove in " + classDir, classDir);
        }
        FileWriteUtil.deleteDirectory(classDir);
        log.debug("Removed class directory {}", classDir);
        return ScaffoldResult.success(
                "Removed " + className + " from " + target.getPackageName() + " -> " + classDir, classDir);
    }

    private ScaffoldResult create(Target target, String className, String version, Path classDir) throws IOException {
        Path moduleFile = moduleFileOf(classDir, className);
        if (Files.exists(moduleFile)) {
            return ScaffoldResult.alreadyExists(
                    "Class '" + className + "' already exists, not overwriting: " + moduleFile, moduleFile);
        }

        markerWriter.ensure(target, classDir, className + " module");
        String moduleContent = renderModule(target, className, version, classDir);
        if (!FileWriteUtil.writeIfAbsent(moduleFile, moduleContent)) {
            return ScaffoldResult.alreadyExists(
                    "Class '" + className + "' already exists, not overwriting: " + moduleFile, moduleFile);
        }

        Path registryFile = registryFileOf(classDir, className);
        boolean registryKept = Files.isRegularFile(registryFile);
        if (!registryKept) {
            try {
                seedRegistry(target, className, version, registryFile).save();
            } catch (IOException | RuntimeException e) {
                log.debug("Rolling back {} after failing to write {}", moduleFile, registryFile);
                Files.deleteIfExists(moduleFile);
                throw e;
            }
        }

        ScaffoldResult.ScaffoldResultBuilder result = ScaffoldResult.builder()
                .status(ResultStatus.SUCCESS)
                .message("Defined " + className + " in " + target.getPackageName() + " -> " + classDir)
                .path(classDir)
                .note("Created: " + moduleFile.getFileName()
                        + (registryKept ? "" : ", " + registryFile.getFileName()))
                .note("Version: " + version);
        if (registryKept) {
            result.note("Kept existing registry document: " + registryFile.getFileName());
        }
        return result.build();
    }

    private String renderModule(Target target, String className, String version, Path classDir) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("packageName", target.javaPackageOf(classDir));
        model.put("className", className);
        model.put("snakeName", NamingUtil.toSnakeCase(className));
        model.put("registryType", className.toLowerCase(Locale.ROOT));
        model.put("version", version);
        return builtinRenderer.render(BuiltinTemplateRenderer.CLASS_MODULE, model);
    }

    private ClassRegistry seedRegistry(Target target, String className, String version, Path registryFile) {
        ClassRegistry registry = new ClassRegistry(registryFile, version, className.toLowerCase(Locale.ROOT), clock);
        registry.putMetadata("description", "Registry for " + className + " instances");
        registry.putMetadata("className", className);
        registry.putMetadata("targetPackage", target.getPackageName());
        registry.putMetadata("autoBackup", true);
        return registry;
    }
}
