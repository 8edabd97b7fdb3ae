package com.dogfold.scaffold.codegen.target;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.config.TargetProbe;

import lombok.NoArgsConstructor;

/**
 * Finds the targets available in a repository.
 *
 * The default target and its legacy key are always registered. Every other configured probe is
 * registered only when both its artifact root and its template root exist.
 */
@NoArgsConstructor
public class TargetDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(TargetDiscoveryService.class);

    public Map<String, Target> discover(Path repoRoot, ScaffoldConfig config) {
        Path repo = repoRoot.toAbsolutePath().normalize();
        Map<String, Target> targets = new LinkedHashMap<>();

        TargetProbe defaultProbe = config.defaultTarget();
        Target defaultTarget = Target.builder()
                .key(canonical(defaultProbe.key()))
                .packageName(defaultProbe.packageName())
                .root(repo.resolve(defaultProbe.sourceRoot()).normalize())
                .templates(repo.resolve(defaultProbe.templatesRoot()).normalize())
                .repoRoot(repo)
                .projectRoot(defaultProbe.projectRoot() != null
                        ? repo.resolve(defaultProbe.projectRoot()).normalize()
                        : repo)
                .build();
        targets.put(defaultTarget.getKey(), defaultTarget);

        String legacyKey = canonical(config.legacyTargetKey());
        if (!legacyKey.isEmpty() && !targets.containsKey(legacyKey)) {
            targets.put(legacyKey, defaultTarget.toBuilder().key(legacyKey).build());
        }

        for (TargetProbe probe : config.targets()) {
            String key = canonical(probe.key());
            if (targets.containsKey(key)) {
                log.warn("Ignoring target probe '{}': key already registered", key);
                continue;
            }
            probe(repo, probe).ifPresent(target -> targets.put(key, target));
        }

        log.debug("Discovered targets in {}: {}", repo, targets.keySet());
        return targets;
    }

    private Optional<Target> probe(Path repo, TargetProbe probe) {
        Path sourceRoot = repo.resolve(probe.sourceRoot()).normalize();
        if (!Files.isDirectory(sourceRoot)) {
            log.debug("Target '{}' not present: {} does not exist", probe.key(), sourceRoot);
            return Optional.empty();
        }

        Optional<Path> root = probe.packageDirDiscovery()
                ? firstPackageDir(sourceRoot)
                : Optional.of(sourceRoot);
        if (root.isEmpty()) {
            log.debug("Target '{}' not present: no package directory under {}", probe.key(), sourceRoot);
            return Optional.empty();
        }

        Path templates = repo.resolve(probe.templatesRoot()).normalize();
        if (!Files.isDirectory(templates)) {
            log.debug("Target '{}' partially present: template root {} does not exist", probe.key(), templates);
            return Optional.empty();
        }

        Path projectRoot = probe.projectRoot() != null
                ? repo.resolve(probe.projectRoot()).normalize()
                : sourceRoot.getParent();

        return Optional.of(Target.builder()
                .key(canonical(probe.key()))
                .packageName(probe.packageName())
                .root(root.get())
                .templates(templates)
                .repoRoot(repo)
                .projectRoot(projectRoot != null ? projectRoot : repo)
                .build());
    }

    private Optional<Path> firstPackageDir(Path sourceRoot) {
        try (Stream<Path> children = Files.list(sourceRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(dir -> {
                        String name = dir.getFileName().toString();
                        return !name.startsWith("__") && !name.startsWith(".");
                    })
                    .min(Comparator.comparing(dir -> dir.getFileName().toString()));
        } catch (IOException e) {
            log.warn("Could not list {}: {}", sourceRoot, e.getMessage());
            return Optional.empty();
        }
    }

    private static String canonical(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    }
}
