package com.dogfold.scaffold.codegen.generator;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.InvalidNameException;
import com.dogfold.scaffold.codegen.exception.TemplateNotFoundException;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.target.TargetResolver;
import com.dogfold.scaffold.codegen.template.TemplateEngine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the verb flow and its template precedence.
 */
class VerbGeneratorTest {

    @TempDir
    Path repoRoot;

    private Target target;
    private Path verbTemplates;
    private VerbGenerator generator;

    @BeforeEach
    void setUp() throws Exception {
        ScaffoldConfig config = ScaffoldConfig.defaults();
        target = TargetResolver.discover(repoRoot, config).resolve(null);
        verbTemplates = Files.createDirectories(target.getTemplates().resolve("verbs"));
        Files.writeString(verbTemplates.resolve("verb_template.java"),
                "public class VerbNameVerb { String name = \"{VERB_NAME}\"; }\n");
        generator = new VerbGenerator(config, new TemplateEngine(), new PackageMarkerWriter(config));
    }

    @Test
    void testPlainVerbFromGenericTemplate() throws Exception {
        ScaffoldResult result = generator.generate(target, "ping", null);

        Path verbFile = target.getRoot().resolve("verbs/ping.java");
        assertThat(result.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.getPath()).isEqualTo(verbFile);
        assertThat(verbFile).hasContent("public class PingVerb { String name = \"ping\"; }\n");
        assertThat(target.getRoot().resolve("verbs/package-info.java")).hasContent("package spec_core.verbs;\n");
    }

    @Test
    void testDomainVerbFromGenericTemplate() throws Exception {
        ScaffoldResult result = generator.generate(target, "billing.invoice", null);

        Path verbFile = target.getRoot().resolve("domains/billing/verbs/invoice.java");
        assertThat(result.getMessage()).contains("billing.invoice");
        assertThat(verbFile).hasContent("public class InvoiceVerb { String name = \"invoice\"; }\n");
    }

    @Test
    void testDomainSpecificTemplateWins() throws Exception {
        Path domainTemplates = Files.createDirectories(target.getTemplates().resolve("domains/billing/verbs"));
        Files.writeString(domainTemplates.resolve("invoice.java"), "domain {DOMAIN_NAME} VerbNameVerb\n");
        Files.writeString(verbTemplates.resolve("invoice.java"), "top-level\n");

        generator.generate(target, "billing.invoice", null);

        assertThat(target.getRoot().resolve("domains/billing/verbs/invoice.java"))
                .hasContent("domain billing InvoiceVerb\n");
    }

    @Test
    void testFallsBackToGenericAfterDomainTemplateIsRemoved() throws Exception {
        Path domainTemplates = Files.createDirectories(target.getTemplates().resolve("domains/billing/verbs"));
        Path refundTemplate = Files.writeString(domainTemplates.resolve("refund.java"), "domain {DOMAIN_NAME}\n");

        ScaffoldResult first = generator.generate(target, "billing.refund", null);
        Files.delete(refundTemplate);
        ScaffoldResult second = generator.generate(target, "billing.void_refund", null);

        assertThat(first.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(second.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(target.getRoot().resolve("domains/billing/verbs/refund.java")).hasContent("domain billing\n");
        assertThat(target.getRoot().resolve("domains/billing/verbs/void_refund.java"))
                .hasContent("public class VoidRefundVerb { String name = \"void_refund\"; }\n");
    }

    @Test
    void testTopLevelTemplateWinsOverGeneric() throws Exception {
        Files.writeString(verbTemplates.resolve("invoice.java"), "top-level {VERB_NAME}\n");

        generator.generate(target, "billing.invoice", null);

        assertThat(target.getRoot().resolve("domains/billing/verbs/invoice.java"))
                .hasContent("top-level invoice\n");
    }

    @Test
    void testMissingTemplatesFail() throws Exception {
        Files.delete(verbTemplates.resolve("verb_template.java"));

        assertThatThrownBy(() -> generator.generate(target, "ping", null))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("verb_template.java");
        assertThat(target.getRoot().resolve("verbs")).doesNotExist();
    }

    @Test
    void testExistingVerbIsNotOverwritten() throws Exception {
        generator.generate(target, "billing.invoice", null);
        Path verbFile = target.getRoot().resolve("domains/billing/verbs/invoice.java");
        byte[] before = Files.readAllBytes(verbFile);
        Files.writeString(verbTemplates.resolve("verb_template.java"), "changed\n");

        ScaffoldResult second = generator.generate(target, "billing.invoice", null);

        assertThat(second.getStatus()).isEqualTo(ResultStatus.WARNING);
        assertThat(second.getMessage()).contains("Verb 'billing.invoice' already exists");
        assertThat(Files.readAllBytes(verbFile)).isEqualTo(before);
    }

    @ParameterizedTest
    @ValueSource(strings = {".foo", "foo.", "a.b.c", ".", ""})
    void testInvalidVerbNames(String name) {
        assertThatThrownBy(() -> generator.generate(target, name, null))
                .isInstanceOf(InvalidNameException.class);
    }

    @Test
    void testInlineCodeIsReportedButNotInjected() throws Exception {
        ScaffoldResult result = generator.generate(target, "ping", "return 42;");

        assertThat(result.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.getNotes()).hasSize(1);
        assertThat(result.getNotes().get(0)).contains("not supported");
        assertThat(target.getRoot().resolve("verbs/ping.java")).content().doesNotContain("return 42;");
    }
}
