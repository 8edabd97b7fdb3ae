package com.dogfold.scaffold.codegen.config;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileYieldsDefaults() {
        ScaffoldConfig config = ConfigLoader.loadFromRepository(tempDir);

        assertThat(config).isEqualTo(ScaffoldConfig.defaults());
        assertThat(config.defaultTarget().key()).isEqualTo(ScaffoldConfig.DEFAULT_TARGET_KEY);
        assertThat(config.artifactExtension()).isEqualTo(".java");
        assertThat(config.packageMarker()).isEqualTo("package-info.java");
        assertThat(config.defaultClassVersion()).isEqualTo("1.0.0");
        assertThat(config.strictPlaceholders()).isFalse();
        assertThat(config.aliases()).containsEntry("spec", "spec-core");
        assertThat(config.targets()).extracting(TargetProbe::key).containsExactly("life-cli");
    }

    @Test
    void testPartialFileKeepsDefaultsForMissingKeys() throws Exception {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), """
                artifactExtension: kt
                strictPlaceholders: true
                defaultTarget:
                  key: app
                  sourceRoot: src/main/java/app
                  templatesRoot: templates
                """);

        ScaffoldConfig config = ConfigLoader.loadFromRepository(tempDir);

        assertThat(config.artifactExtension()).isEqualTo(".kt");
        assertThat(config.strictPlaceholders()).isTrue();
        assertThat(config.defaultTarget().key()).isEqualTo("app");
        assertThat(config.defaultTarget().packageName()).isEqualTo("app");
        assertThat(config.packageMarker()).isEqualTo("package-info.java");
        assertThat(config.legacyTargetKey()).isEqualTo(ScaffoldConfig.LEGACY_TARGET_KEY);
    }

    @Test
    void testInvalidFileFallsBackToDefaults() throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "targets: [ {key: x} ]\n");

        assertThat(ConfigLoader.load(file)).isEqualTo(ScaffoldConfig.defaults());
    }

    @Test
    void testUnknownKeysAreIgnored() throws Exception {
        Path file = tempDir.resolve("extra.yml");
        Files.writeString(file, "somethingElse: 42\ndefaultClassVersion: 2.0.0\n");

        assertThat(ConfigLoader.load(file).defaultClassVersion()).isEqualTo("2.0.0");
    }
}
