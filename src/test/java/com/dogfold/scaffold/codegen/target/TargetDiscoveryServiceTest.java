package com.dogfold.scaffold.codegen.target;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.config.TargetProbe;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for target discovery.
 */
class TargetDiscoveryServiceTest {

    @TempDir
    Path repoRoot;

    private final TargetDiscoveryService discoveryService = new TargetDiscoveryService();

    @Test
    void testDefaultAndLegacyTargetsAlwaysRegistered() {
        Map<String, Target> targets = discoveryService.discover(repoRoot, ScaffoldConfig.defaults());

        assertThat(targets).containsOnlyKeys("spec-core", "spec-dev");
        assertThat(targets.get("spec-dev").getRoot()).isEqualTo(targets.get("spec-core").getRoot());
        assertThat(targets.get("spec-core").getTemplates())
                .isEqualTo(repoRoot.toAbsolutePath().normalize().resolve("src/spec/templates"));
    }

    @Test
    void testPackageDirDiscoveryPicksFirstDirectoryInNameOrder() throws Exception {
        Path src = repoRoot.resolve("life-cli/src");
        Files.createDirectories(src.resolve("__pycache__"));
        Files.createDirectories(src.resolve(".hidden"));
        Files.createDirectories(src.resolve("zeta"));
        Files.createDirectories(src.resolve("alpha"));
        Files.createDirectories(repoRoot.resolve("scripts/life-cli/templates"));

        Target lifeCli = discoveryService.discover(repoRoot, ScaffoldConfig.defaults()).get("life-cli");

        assertThat(lifeCli).isNotNull();
        assertThat(lifeCli.getRoot().getFileName().toString()).isEqualTo("alpha");
        assertThat(lifeCli.getProjectRoot()).isEqualTo(repoRoot.toAbsolutePath().normalize().resolve("life-cli"));
    }

    @Test
    void testPartiallyPresentTargetIsSkipped() throws Exception {
        Files.createDirectories(repoRoot.resolve("life-cli/src/life_cli"));

        Map<String, Target> targets = discoveryService.discover(repoRoot, ScaffoldConfig.defaults());

        assertThat(targets).doesNotContainKey("life-cli");
    }

    @Test
    void testProbeCollidingWithRegisteredKeyIsSkipped() throws Exception {
        Files.createDirectories(repoRoot.resolve("other/src"));
        Files.createDirectories(repoRoot.resolve("other/templates"));
        TargetProbe colliding = new TargetProbe("SPEC-CORE", null, "other/src", false, "other/templates", null);
        ScaffoldConfig config = new ScaffoldConfig(null, null, null, List.of(colliding), null, null, null, false);

        Target specCore = discoveryService.discover(repoRoot, config).get("spec-core");

        assertThat(specCore.getRoot()).isEqualTo(repoRoot.toAbsolutePath().normalize().resolve("src/spec"));
    }

    @Test
    void testJavaPackageOfDirectoryUnderRoot() {
        Target target = discoveryService.discover(repoRoot, ScaffoldConfig.defaults()).get("spec-core");

        assertThat(target.javaPackageOf(target.getRoot())).isEqualTo("spec_core");
        assertThat(target.javaPackageOf(target.getRoot().resolve("domains/billing/verbs")))
                .isEqualTo("spec_core.domains.billing.verbs");
    }
}
