package io.github.drompincen.webdeck.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisabledOnOs(OS.WINDOWS)
class ExecutableLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void findsExecutableOnPath() throws Exception {
        Path empty = Files.createDirectory(tempDir.resolve("empty"));
        Path bin = Files.createDirectory(tempDir.resolve("bin"));
        Path claude = Files.writeString(bin.resolve("claude"), "#!/bin/sh\n");
        claude.toFile().setExecutable(true);
        ExecutableLocator locator = new ExecutableLocator(empty + File.pathSeparator + bin, false);

        assertThat(locator.find("claude")).contains(claude.toAbsolutePath());
        assertThat(locator.resolve("claude")).isEqualTo(claude.toAbsolutePath().toString());
    }

    @Test
    void nonExecutableFilesAreSkipped() throws Exception {
        Files.writeString(tempDir.resolve("claude"), "data");
        ExecutableLocator locator = new ExecutableLocator(tempDir.toString(), false);

        assertThat(locator.find("claude")).isEmpty();
    }

    @Test
    void unknownNameResolvesToItself() {
        ExecutableLocator locator = new ExecutableLocator(tempDir.toString(), false);

        assertThat(locator.resolve("claude")).isEqualTo("claude");
    }

    @Test
    void explicitPathIsUsedAsGiven() {
        ExecutableLocator locator = new ExecutableLocator(null, false);

        assertThat(locator.resolve("/opt/claude/bin/claude")).isEqualTo("/opt/claude/bin/claude");
    }
}
