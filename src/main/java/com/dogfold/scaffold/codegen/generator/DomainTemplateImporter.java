package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.exception.TemplateNotFoundException;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;
import com.dogfold.scaffold.codegen.util.NamingUtil;

/**
 * Builds a domain by copying a prepared domain template tree from {@code templates/domains/<name>}.
 *
 * Files below a top-level {@code schemas} folder are collected flat in {@code schemas/<name>}
 * next to {@code domains}. Files that already exist are skipped.
 */
public class DomainTemplateImporter {

    private static final Logger log = LoggerFactory.getLogger(DomainTemplateImporter.class);

    static final String SCHEMAS_DIR = "schemas";

    private final PackageMarkerWriter markerWriter;

    public DomainTemplateImporter(PackageMarkerWriter markerWriter) {
        this.markerWriter = markerWriter;
    }

    public ScaffoldResult importDomain(Target target, String name) throws IOException {
        NamingUtil.requireSimpleName("Domain", name);

        Path templatesDir = target.getTemplates().resolve("domains").resolve(name);
        if (!Files.isDirectory(templatesDir)) {
            throw new TemplateNotFoundException(templatesDir,
                    "Templates not found for domain '" + name + "': " + templatesDir);
        }
        Path domainDir = target.getRoot().resolve("domains").resolve(name);
        Path schemasDir = target.getRoot().resolve(SCHEMAS_DIR).resolve(name);
        FileWriteUtil.createDirectories(domainDir);

        int copied = 0;
        int skipped = 0;
        for (Path source : templateFiles(templatesDir)) {
            Path relative = templatesDir.relativize(source);
            Path destination = relative.getNameCount() > 1 && SCHEMAS_DIR.equals(relative.getName(0).toString())
                    ? schemasDir.resolve(relative.getFileName().toString())
                    : domainDir.resolve(relative.toString());
            if (FileWriteUtil.copyIfAbsent(source, destination)) {
                log.debug("Copied {} -> {}", relative, destination);
                copied++;
            } else {
                log.debug("Skipped existing {}", destination);
                skipped++;
            }
        }

        for (String subdir : List.of("classes", "verbs")) {
            Path dir = domainDir.resolve(subdir);
            if (Files.isDirectory(dir)) {
                markerWriter.ensure(target, dir, null);
            }
        }

        return ScaffoldResult.builder()
                .status(ResultStatus.SUCCESS)
                .message("Built domain '" + name + "' in " + target.getPackageName() + " -> " + domainDir)
                .path(domainDir)
                .note(copied + " file(s) copied, " + skipped + " skipped")
                .build();
    }

    private List<Path> templateFiles(Path templatesDir) throws IOException {
        try (Stream<Path> walk = Files.walk(templatesDir)) {
            return walk.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
