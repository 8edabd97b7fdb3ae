package com.dogfold.scaffold.integration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dogfold.scaffold.cli.DogCommand;
import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldGenerator;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.model.ClassDefinitionRequest;
import com.dogfold.scaffold.codegen.target.TargetResolver;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end scenarios over a repository with the default layout.
 */
class ScaffoldIntegrationTest {

    @TempDir
    Path repoRoot;

    private Path specRoot;
    private ScaffoldGenerator generator;

    @BeforeEach
    void setUp() throws Exception {
        specRoot = repoRoot.resolve("src/spec");
        Path verbTemplates = Files.createDirectories(repoRoot.resolve("src/spec/templates/verbs"));
        Files.writeString(verbTemplates.resolve("verb_template.java"),
                "package {DOMAIN_NAME};\n\npublic class VerbNameVerb {\n    public String name() {\n"
                        + "        return \"{VERB_NAME}\";\n    }\n}\n");

        ScaffoldConfig config = ScaffoldConfig.defaults();
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);
        generator = new ScaffoldGenerator(TargetResolver.discover(repoRoot, config), config, clock);
    }

    @Test
    void testBillingDomainAndInvoiceVerbThroughCommandLine() throws Exception {
        assertThat(dog("register", "domain", "billing")).isZero();
        assertThat(dog("register", "verb", "billing.invoice")).isZero();

        Path verbFile = specRoot.resolve("domains/billing/verbs/invoice.java");
        assertThat(verbFile).hasContent(
                "package billing;\n\npublic class InvoiceVerb {\n    public String name() {\n"
                        + "        return \"invoice\";\n    }\n}\n");
        byte[] firstRun = Files.readAllBytes(verbFile);

        assertThat(dog("register", "domain", "billing")).isZero();
        assertThat(dog("register", "verb", "billing.invoice")).isZero();
        assertThat(Files.readAllBytes(verbFile)).isEqualTo(firstRun);
    }

    @Test
    void testSecondRunReportsAlreadyExists() {
        assertThat(generator.registerDomain("billing", null).isSuccess()).isTrue();
        assertThat(generator.registerVerb("billing.invoice", null, null).isSuccess()).isTrue();

        ScaffoldResult second = generator.registerVerb("billing.invoice", "spec", null);

        assertThat(second.getStatus()).isEqualTo(ResultStatus.WARNING);
        assertThat(second.render()).startsWith("⚠️ Verb 'billing.invoice' already exists");
        assertThat(ResultStatus.exitCodeOf(second.render())).isZero();
    }

    @Test
    void testFailuresBecomeErrorResults() {
        ScaffoldResult unknownTarget = generator.registerDomain("billing", "nope");
        ScaffoldResult badName = generator.registerVerb(".foo", null, null);
        ScaffoldResult noTemplate = generator.registerCli("admin", null);

        assertThat(unknownTarget.render()).startsWith("❌ Unknown target 'nope'");
        assertThat(badName.getStatus()).isEqualTo(ResultStatus.ERROR);
        assertThat(noTemplate.getStatus()).isEqualTo(ResultStatus.ERROR);
        assertThat(unknownTarget.exitCode()).isEqualTo(1);
    }

    @Test
    void testClassLifecycleInDomain() throws Exception {
        generator.registerDomain("billing", null);

        ScaffoldResult defined = generator.defineClass(ClassDefinitionRequest.builder()
                .className("Invoice")
                .domain("billing")
                .build());
        Path classDir = specRoot.resolve("domains/billing/classes/invoice");

        assertThat(defined.isSuccess()).isTrue();
        assertThat(classDir.resolve("invoice_registry.yml")).content()
                .contains("createdAt: \"2026-10-19T10:15:30Z\"")
                .contains("targetPackage: \"spec-core\"");

        ScaffoldResult removed = generator.defineClass(ClassDefinitionRequest.builder()
                .className("Invoice")
                .domain("billing")
                .reverse(true)
                .build());

        assertThat(removed.isSuccess()).isTrue();
        assertThat(classDir).doesNotExist();
        assertThat(specRoot.resolve("domains/billing/classes/package-info.java")).exists();
    }

    private int dog(String... args) {
        String[] withRepo = new String[args.length + 2];
        System.arraycopy(args, 0, withRepo, 0, args.length);
        withRepo[args.length] = "--repo-root";
        withRepo[args.length + 1] = repoRoot.toString();
        return new CommandLine(new DogCommand()).execute(withRepo);
    }
}
