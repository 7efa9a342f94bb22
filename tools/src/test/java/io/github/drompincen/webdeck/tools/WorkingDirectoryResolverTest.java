package io.github.drompincen.webdeck.tools;

import io.github.drompincen.webdeck.protocol.api.PathValidationResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkingDirectoryResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void existingDirectoryIsUsed() throws Exception {
        Path project = Files.createDirectory(tempDir.resolve("project"));
        WorkingDirectoryResolver resolver = resolver(List.of(tempDir));

        assertThat(resolver.resolve(project.toString())).isEqualTo(project);
    }

    @Test
    void absentRequestUsesProcessDirectory() {
        WorkingDirectoryResolver resolver = resolver(List.of(tempDir));

        assertThat(resolver.resolve(null)).isEqualTo(Path.of("").toAbsolutePath());
        assertThat(resolver.resolve("  ")).isEqualTo(Path.of("").toAbsolutePath());
    }

    @Test
    void missingDirectoryFallsBackToFirstExistingFallback() {
        Path missingHome = tempDir.resolve("no-home");
        WorkingDirectoryResolver resolver = resolver(List.of(missingHome, tempDir));

        assertThat(resolver.resolve(tempDir.resolve("missing").toString())).isEqualTo(tempDir);
    }

    @Test
    void translatedPathReturnedWhenNothingExists() {
        WorkingDirectoryResolver resolver = resolver(List.of(tempDir.resolve("a"), tempDir.resolve("b")));

        assertThat(resolver.resolve("/definitely/not/here")).isEqualTo(Path.of("/definitely/not/here"));
    }

    @Test
    void tildeResolvesToHome() {
        WorkingDirectoryResolver resolver = resolver(List.of());

        assertThat(resolver.resolve("~")).isEqualTo(tempDir);
    }

    @Test
    void validateReportsEachOutcome() throws Exception {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "x");
        WorkingDirectoryResolver resolver = resolver(List.of());

        assertThat(resolver.validate(tempDir.toString()))
                .isEqualTo(PathValidationResponse.valid("Directory exists and is accessible"));
        assertThat(resolver.validate(file.toString()))
                .isEqualTo(PathValidationResponse.invalid("Path exists but is not a directory"));
        assertThat(resolver.validate(tempDir.resolve("missing").toString()))
                .isEqualTo(PathValidationResponse.invalid("Directory does not exist"));
        assertThat(resolver.validate("   "))
                .isEqualTo(PathValidationResponse.invalid("Path cannot be empty"));
        assertThat(resolver.validate("/" + "a".repeat(WorkingDirectoryResolver.MAX_PATH_LENGTH)))
                .isEqualTo(PathValidationResponse.invalid("Path is too long"));
    }

    private WorkingDirectoryResolver resolver(List<Path> fallbacks) {
        return new WorkingDirectoryResolver(new PathTranslator(false, tempDir), fallbacks);
    }
}
