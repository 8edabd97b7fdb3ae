package com.dogfold.scaffold.codegen.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scaffolding configuration, loaded from {@code dogfold.yml} in the repository root.
 *
 * <p>Every key is optional; missing keys take the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * defaultTarget:
 *   key: spec-core
 *   sourceRoot: src/spec
 *   templatesRoot: src/spec/templates
 * legacyTargetKey: spec-dev
 * aliases:
 *   spec: spec-core
 * targets:
 *   - key: life-cli
 *     sourceRoot: life-cli/src
 *     packageDirDiscovery: true
 *     templatesRoot: scripts/life-cli/templates
 *     projectRoot: life-cli
 * artifactExtension: .java
 * packageMarker: package-info.java
 * defaultClassVersion: 1.0.0
 * strictPlaceholders: false
 * }</pre>
 *
 * @param defaultTarget target used when no selector is given; always registered
 * @param legacyTargetKey backward-compatible key registered at the default target's location
 * @param aliases alternate spellings mapped to canonical target keys
 * @param targets optional targets, registered only when their directories exist
 * @param artifactExtension file extension of template-driven artifacts
 * @param packageMarker name of the marker file created in generated directories
 * @param defaultClassVersion version used by class definitions that do not give one
 * @param strictPlaceholders fail instead of warn on unknown placeholder tokens
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScaffoldConfig(
    @JsonProperty("defaultTarget") TargetProbe defaultTarget,
    @JsonProperty("legacyTargetKey") String legacyTargetKey,
    @JsonProperty("aliases") Map<String, String> aliases,
    @JsonProperty("targets") List<TargetProbe> targets,
    @JsonProperty("artifactExtension") String artifactExtension,
    @JsonProperty("packageMarker") String packageMarker,
    @JsonProperty("defaultClassVersion") String defaultClassVersion,
    @JsonProperty("strictPlaceholders") boolean strictPlaceholders
) {
    public static final String DEFAULT_TARGET_KEY = "spec-core";
    public static final String LEGACY_TARGET_KEY = "spec-dev";
    public static final String DEFAULT_CLASS_VERSION = "1.0.0";

    public ScaffoldConfig {
        if (defaultTarget == null) {
            defaultTarget = defaultTargetProbe();
        }
        if (legacyTargetKey == null) {
            legacyTargetKey = LEGACY_TARGET_KEY;
        }
        aliases = aliases == null ? defaultAliases() : Map.copyOf(aliases);
        targets = targets == null ? defaultProbes() : List.copyOf(targets);
        if (artifactExtension == null || artifactExtension.isBlank()) {
            artifactExtension = ".java";
        } else if (!artifactExtension.startsWith(".")) {
            artifactExtension = "." + artifactExtension;
        }
        if (packageMarker == null || packageMarker.isBlank()) {
            packageMarker = "package-info.java";
        }
        if (defaultClassVersion == null || defaultClassVersion.isBlank()) {
            defaultClassVersion = DEFAULT_CLASS_VERSION;
        }
    }

    /**
     * Creates the default configuration: the {@code spec-core} target under {@code src/spec},
     * its {@code spec-dev} legacy key, and the optional {@code life-cli} target.
     *
     * @return default configuration
     */
    public static ScaffoldConfig defaults() {
        return new ScaffoldConfig(null, null, null, null, null, null, null, false);
    }

    private static TargetProbe defaultTargetProbe() {
        return new TargetProbe(DEFAULT_TARGET_KEY, DEFAULT_TARGET_KEY, "src/spec", false, "src/spec/templates", null);
    }

    private static Map<String, String> defaultAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("spec", DEFAULT_TARGET_KEY);
        aliases.put("spec-dev", DEFAULT_TARGET_KEY);
        aliases.put("spec_core", DEFAULT_TARGET_KEY);
        aliases.put("spec-core", DEFAULT_TARGET_KEY);
        return Map.copyOf(aliases);
    }

    private static List<TargetProbe> defaultProbes() {
        return List.of(new TargetProbe("life-cli", "life-cli", "life-cli/src", true,
                "scripts/life-cli/templates", "life-cli"));
    }
}
