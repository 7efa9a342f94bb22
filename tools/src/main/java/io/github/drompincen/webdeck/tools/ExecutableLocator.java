package io.github.drompincen.webdeck.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds executables on the {@code PATH}, the way {@code which} does.
 */
public class ExecutableLocator {

    private static final Logger log = LoggerFactory.getLogger(ExecutableLocator.class);

    private final List<Path> directories;
    private final List<String> extensions;

    public ExecutableLocator(String pathVariable, boolean windows) {
        this.directories = new ArrayList<>();
        if (pathVariable != null) {
            for (String entry : pathVariable.split(File.pathSeparator)) {
                if (entry.isBlank()) continue;
                try {
                    directories.add(Path.of(entry));
                } catch (InvalidPathException e) {
                    log.debug("Ignoring unusable PATH entry {}: {}", entry, e.getMessage());
                }
            }
        }
        this.extensions = windows ? List.of(".exe", ".cmd", ".bat", "") : List.of("");
    }

    public static ExecutableLocator system() {
        return new ExecutableLocator(System.getenv("PATH"), Platform.isWindows());
    }

    public Optional<Path> find(String name) {
        for (Path dir : directories) {
            for (String ext : extensions) {
                Path candidate = dir.resolve(name + ext);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate.toAbsolutePath());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Absolute paths and paths with a directory part are used as given; bare names are
     * looked up on the PATH and returned unchanged when not found, leaving the final
     * lookup to the operating system.
     */
    public String resolve(String configured) {
        if (configured.contains("/") || configured.contains("\\")) {
            return configured;
        }
        return find(configured).map(Path::toString).orElse(configured);
    }
}
