package com.dogfold.scaffold.codegen.generator;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dogfold.scaffold.codegen.ResultStatus;
import com.dogfold.scaffold.codegen.ScaffoldResult;
import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.TemplateNotFoundException;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.target.TargetResolver;
import com.dogfold.scaffold.codegen.template.TemplateEngine;

import static org.assertj.core.api.Assertions.*;

class PlainClassGeneratorTest {

    @TempDir
    Path repoRoot;

    private Target target;
    private PlainClassGenerator generator;

    @BeforeEach
    void setUp() throws Exception {
        ScaffoldConfig config = ScaffoldConfig.defaults();
        target = TargetResolver.discover(repoRoot, config).resolve(null);
        Files.createDirectories(target.getTemplates());
        Files.writeString(target.getTemplates().resolve("class_template.java"),
                "public class {CLASS_NAME} {}\n");
        generator = new PlainClassGenerator(config, new TemplateEngine(), new PackageMarkerWriter(config));
    }

    @Test
    void testInlineCodeIsWrittenVerbatim() throws Exception {
        ScaffoldResult result = generator.generate(target, "CustomerNote", null, "class CustomerNote {}");

        assertThat(result.getStatus()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(target.getRoot().resolve("customer_note.java")).hasContent("class CustomerNote {}\n");
    }

    @Test
    void testGenericTemplate() throws Exception {
        generator.generate(target, "CustomerNote", null, null);

        assertThat(target.getRoot().resolve("customer_note.java")).hasContent("public class CustomerNote {}\n");
    }

    @Test
    void testDomainSpecificTemplateWins() throws Exception {
        Path specific = Files.createDirectories(target.getTemplates().resolve("domains/billing/classes"));
        Files.writeString(specific.resolve("invoice.java"), "// {DOMAIN_NAME}\nclass {CLASS_NAME} {}\n");

        ScaffoldResult result = generator.generate(target, "Invoice", "billing", null);

        Path classFile = target.getRoot().resolve("domains/billing/classes/invoice.java");
        assertThat(result.getPath()).isEqualTo(classFile);
        assertThat(classFile).hasContent("// billing\nclass Invoice {}\n");
        assertThat(target.getRoot().resolve("domains/billing/classes/package-info.java")).exists();
    }

    @Test
    void testExistingFileIsNeverOverwritten() throws Exception {
        generator.generate(target, "Invoice", null, "first");

        ScaffoldResult second = generator.generate(target, "Invoice", null, "second");

        assertThat(second.getStatus()).isEqualTo(ResultStatus.WARNING);
        assertThat(target.getRoot().resolve("invoice.java")).hasContent("first\n");
    }

    @Test
    void testMissingTemplatesFail() throws Exception {
        Files.delete(target.getTemplates().resolve("class_template.java"));

        assertThatThrownBy(() -> generator.generate(target, "Invoice", null, null))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("class_template.java");
    }
}
