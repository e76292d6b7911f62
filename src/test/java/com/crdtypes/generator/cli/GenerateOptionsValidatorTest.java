package com.crdtypes.generator.cli;

import com.crdtypes.generator.cli.exception.OptionsValidationException;
import com.crdtypes.generator.cli.model.GenerateOptions;
import com.crdtypes.generator.cli.model.ValidatedGenerateOptions;
import com.crdtypes.generator.cli.validation.GenerateOptionsValidator;
import com.crdtypes.generator.codegen.derive.CapabilityTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path crdFile;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        crdFile = Files.writeString(tempDir.resolve("crd.yaml"), "kind: CustomResourceDefinition\n");
    }

    @Test
    void testValidOptions() {
        GenerateOptions options = parse(crdFile.toString(), "-D", "PartialEq", "-D", "@enum=Default",
                "-o", tempDir.resolve("out").toString(), "-p", "org.acme.types");

        ValidatedGenerateOptions validated = validator.validate(options);

        assertThat(validated.getCrdFile()).isEqualTo(crdFile.toAbsolutePath().normalize());
        assertThat(validated.getOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
        assertThat(validated.getCapabilityRequests()).hasSize(2);
        assertThat(validated.getCapabilityRequests().get(1).getTarget()).isEqualTo(CapabilityTarget.ENUMS);
    }

    @Test
    void testMissingCrdFile() {
        GenerateOptions options = parse(tempDir.resolve("absent.yaml").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("absent.yaml");
    }

    @Test
    void testAllErrorsAreCollected() {
        GenerateOptions options = parse(crdFile.toString(), "--api-version", "v1", "--combine-versions",
                "-D", "Hash", "-p", "com.example.class");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(3)
                        .anyMatch(m -> m.contains("--combine-versions"))
                        .anyMatch(m -> m.contains("Hash"))
                        .anyMatch(m -> m.contains("com.example.class")));
    }

    @Test
    void testBlankElide() {
        GenerateOptions options = parse(crdFile.toString(), "--elide", " ");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--elide");
    }

    @Test
    void testOutputPathThatIsAFile() {
        GenerateOptions options = parse(crdFile.toString(), "-o", crdFile.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void testInvalidPackageNames() {
        assertThatThrownBy(() -> validator.validate(parse(crdFile.toString(), "-p", "com..example")))
                .isInstanceOf(OptionsValidationException.class);
        assertThatThrownBy(() -> validator.validate(parse(crdFile.toString(), "-p", "1com.example")))
                .isInstanceOf(OptionsValidationException.class);
    }

    private static GenerateOptions parse(String... args) {
        return CommandLine.populateCommand(new GenerateOptions(), args);
    }
}
