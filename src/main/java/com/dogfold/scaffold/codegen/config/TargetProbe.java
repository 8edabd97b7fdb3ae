package com.dogfold.scaffold.codegen.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where to look for a target inside a repository. All paths are relative to the repository root.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * key: life-cli
 * packageName: life-cli
 * sourceRoot: life-cli/src
 * packageDirDiscovery: true
 * templatesRoot: scripts/life-cli/templates
 * projectRoot: life-cli
 * }</pre>
 *
 * @param key canonical target key
 * @param packageName display name of the target package (defaults to the key)
 * @param sourceRoot directory generated artifacts are written under
 * @param packageDirDiscovery when true, the artifact root is the first package directory found
 *                            under {@code sourceRoot} rather than {@code sourceRoot} itself
 * @param templatesRoot template directory of the target
 * @param projectRoot project directory (defaults to the parent of {@code sourceRoot})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetProbe(
    @JsonProperty("key") String key,
    @JsonProperty("packageName") String packageName,
    @JsonProperty("sourceRoot") String sourceRoot,
    @JsonProperty("packageDirDiscovery") boolean packageDirDiscovery,
    @JsonProperty("templatesRoot") String templatesRoot,
    @JsonProperty("projectRoot") String projectRoot
) {
    public TargetProbe {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Target probe requires a key");
        }
        if (sourceRoot == null || sourceRoot.isBlank()) {
            throw new IllegalArgumentException("Target probe '" + key + "' requires a sourceRoot");
        }
        if (templatesRoot == null || templatesRoot.isBlank()) {
            throw new IllegalArgumentException("Target probe '" + key + "' requires a templatesRoot");
        }
        if (packageName == null || packageName.isBlank()) {
            packageName = key;
        }
    }
}
