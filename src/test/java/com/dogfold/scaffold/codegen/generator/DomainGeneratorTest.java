package com.dogfold.scaffold.codegen.generator;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.InvalidNameException;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.target.TargetResolver;
import com.dogfold.scaffold.codegen.template.BuiltinTemplateRenderer;
import com.dogfold.scaffold.codegen.template.TemplateEngine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the domain flow.
 */
class DomainGeneratorTest {

    @TempDir
    Path repoRoot;

    private Target target;
    private DomainGenerator generator;

    @BeforeEach
    void setUp() {
        ScaffoldConfig config = ScaffoldConfig.defaults();
        target = TargetResolver.discover(repoRoot, config).resolve(null);
        generator = new DomainGenerator(config, new TemplateEngine(), new BuiltinTemplateRenderer(),
                new PackageMarkerWriter(config));
    }

    @Test
    void testCreatesDomainLayoutWithMarkers() throws Exception {
        ScaffoldResult result = generator.generate(target, "billing");

        Path domain = target.getRoot().resolve("domains/billing");
        assertThat(result.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.getPath()).isEqualTo(domain);
        assertThat(result.getMessage()).contains("billing").contains(domain.toString());
        assertThat(target.getRoot().resolve("domains/package-info.java")).exists();
        assertThat(domain.resolve("package-info.java")).hasContent(
                "/** billing domain */\npackage spec_core.domains.billing;\n");
        assertThat(domain.resolve("classes/package-info.java")).hasContent("package spec_core.domains.billing.classes;\n");
        assertThat(domain.resolve("verbs/package-info.java")).exists();
        assertThat(domain.resolve("BillingCommands.java"))
                .content().contains("public class BillingCommands");
    }

    @Test
    void testUsesDomainCommandsTemplateWhenPresent() throws Exception {
        Files.createDirectories(target.getTemplates());
        Files.writeString(target.getTemplates().resolve("domain_commands_template.java"),
                "// commands for {DOMAIN_NAME}\n");

        generator.generate(target, "billing");

        assertThat(target.getRoot().resolve("domains/billing/BillingCommands.java"))
                .hasContent("// commands for billing\n");
    }

    @Test
    void testSecondRunReportsAlreadyExistsAndChangesNothing() throws Exception {
        generator.generate(target, "billing");
        Path commands = target.getRoot().resolve("domains/billing/BillingCommands.java");
        byte[] before = Files.readAllBytes(commands);

        ScaffoldResult second = generator.generate(target, "billing");

        assertThat(second.getStatus()).isEqualTo(ResultStatus.WARNING);
        assertThat(second.getMessage()).contains("already exists");
        assertThat(second.exitCode()).isZero();
        assertThat(Files.readAllBytes(commands)).isEqualTo(before);
    }

    @Test
    void testFillsInMissingPieces() throws Exception {
        generator.generate(target, "billing");
        Path verbsMarker = target.getRoot().resolve("domains/billing/verbs/package-info.java");
        Files.delete(verbsMarker);

        ScaffoldResult result = generator.generate(target, "billing");

        assertThat(result.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.getNotes()).containsExactly("Filled in 1 missing file(s)");
        assertThat(verbsMarker).exists();
    }

    @Test
    void testDoesNotRecreateDomainsMarkerWhenDirectoryExists() throws Exception {
        Files.createDirectories(target.getRoot().resolve("domains"));

        generator.generate(target, "billing");

        assertThat(target.getRoot().resolve("domains/package-info.java")).doesNotExist();
    }

    @Test
    void testRejectsPathLikeNames() {
        assertThatThrownBy(() -> generator.generate(target, "../escape"))
                .isInstanceOf(InvalidNameException.class);
    }
}
