package io.github.drompincen.webdeck.tools;

import io.github.drompincen.webdeck.protocol.api.PathValidationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a requested working directory to one that exists on this host, falling back to
 * the home directory, the temp directory and the filesystem root in that order.
 */
public class WorkingDirectoryResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkingDirectoryResolver.class);
    static final int MAX_PATH_LENGTH = 500;

    private final PathTranslator translator;
    private final List<Path> fallbacks;

    public WorkingDirectoryResolver(PathTranslator translator, List<Path> fallbacks) {
        this.translator = translator;
        this.fallbacks = List.copyOf(fallbacks);
    }

    public static WorkingDirectoryResolver system() {
        PathTranslator translator = PathTranslator.system();
        List<Path> fallbacks = new ArrayList<>();
        fallbacks.add(translator.home());
        fallbacks.add(Path.of(System.getProperty("java.io.tmpdir")));
        FileSystems.getDefault().getRootDirectories().forEach(fallbacks::add);
        return new WorkingDirectoryResolver(translator, fallbacks);
    }

    public PathTranslator translator() { return translator; }

    /**
     * @return the directory to run in; the process working directory when none was requested
     */
    public Path resolve(String requested) {
        if (requested == null || requested.isBlank()) {
            return Path.of("").toAbsolutePath();
        }
        String translated = translator.translate(requested);
        Optional<Path> direct = asDirectory(translated);
        if (direct.isPresent()) {
            return direct.get();
        }
        for (Path fallback : fallbacks) {
            if (Files.isDirectory(fallback)) {
                log.warn("Working directory {} not found, using {}", requested, fallback);
                return fallback;
            }
        }
        log.warn("Working directory {} not found and no fallback exists", requested);
        return Path.of(translated);
    }

    public PathValidationResponse validate(String path) {
        if (path.length() > MAX_PATH_LENGTH) {
            return PathValidationResponse.invalid("Path is too long");
        }
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return PathValidationResponse.invalid("Path cannot be empty");
        }
        Path target;
        try {
            target = Path.of(translator.translate(trimmed));
        } catch (InvalidPathException e) {
            return PathValidationResponse.invalid("Directory does not exist");
        }
        try {
            BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class);
            if (!attrs.isDirectory()) {
                return PathValidationResponse.invalid("Path exists but is not a directory");
            }
            if (!Files.isReadable(target) || !Files.isExecutable(target)) {
                return PathValidationResponse.invalid("Permission denied - cannot access this directory");
            }
            return PathValidationResponse.valid("Directory exists and is accessible");
        } catch (NoSuchFileException e) {
            return PathValidationResponse.invalid("Directory does not exist");
        } catch (AccessDeniedException e) {
            return PathValidationResponse.invalid("Permission denied - cannot access this directory");
        } catch (IOException e) {
            log.warn("Failed to validate path {}: {}", target, e.getMessage());
            return PathValidationResponse.invalid("Error validating path: " + e.getMessage());
        }
    }

    private static Optional<Path> asDirectory(String candidate) {
        try {
            Path path = Path.of(candidate);
            return Files.isDirectory(path) ? Optional.of(path) : Optional.empty();
        } catch (InvalidPathException e) {
            log.debug("Unusable working directory {}: {}", candidate, e.getMessage());
            return Optional.empty();
        }
    }
}
