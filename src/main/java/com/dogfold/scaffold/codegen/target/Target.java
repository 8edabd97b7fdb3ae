package com.dogfold.scaffold.codegen.target;

import java.nio.file.Path;

import com.dogfold.scaffold.codegen.util.NamingUtil;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A package scaffolds are generated into.
 *
 * Pure structure only: created during discovery and never mutated.
 */
@Value
@Builder(toBuilder = true)
public class Target {

    /**
     * Canonical lowercase identifier.
     */
    @NonNull
    String key;

    /**
     * Display name of the package.
     */
    @NonNull
    String packageName;

    /**
     * Directory generated artifacts are written under.
     */
    @NonNull
    Path root;

    @NonNull
    Path templates;

    @NonNull
    Path repoRoot;

    @NonNull
    Path projectRoot;

    /**
     * Dotted package name of a directory under the target root, for example
     * {@code spec_core.domains.billing} for {@code <root>/domains/billing}.
     */
    public String javaPackageOf(Path dir) {
        StringBuilder sb = new StringBuilder(NamingUtil.toPackageSegment(packageName));
        Path relative = root.relativize(dir.toAbsolutePath().normalize());
        for (Path segment : relative) {
            String name = segment.toString();
            if (!name.isEmpty()) {
                sb.append('.').append(NamingUtil.toPackageSegment(name));
            }
        }
        return sb.toString();
    }
}
