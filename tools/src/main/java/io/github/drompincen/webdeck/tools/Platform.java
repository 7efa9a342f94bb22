package io.github.drompincen.webdeck.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Facts about the host the server runs on.
 */
public final class Platform {

    private static final Logger log = LoggerFactory.getLogger(Platform.class);
    private static final Path PROC_VERSION = Path.of("/proc/version");

    private static volatile Boolean wsl;

    private Platform() {}

    /** {@code windows}, {@code darwin} or {@code linux}. */
    public static String os() {
        return os(System.getProperty("os.name", ""));
    }

    static String os(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.contains("win")) return "windows";
        if (name.contains("mac") || name.contains("darwin")) return "darwin";
        return "linux";
    }

    public static boolean isWindows() {
        return "windows".equals(os());
    }

    public static Path homeDirectory() {
        return homeDirectory(System.getenv(), System.getProperty("user.home"));
    }

    static Path homeDirectory(Map<String, String> env, String userHome) {
        String home = firstNonBlank(env.get("HOME"), env.get("USERPROFILE"), userHome);
        if (home != null) {
            return Path.of(home);
        }
        String user = firstNonBlank(env.get("USER"), "user");
        return Path.of("/home/" + user);
    }

    public static boolean isWsl() {
        Boolean cached = wsl;
        if (cached == null) {
            cached = detectWsl();
            wsl = cached;
        }
        return cached;
    }

    private static boolean detectWsl() {
        if (!"linux".equals(os())) {
            return false;
        }
        String procVersion = null;
        try {
            procVersion = Files.readString(PROC_VERSION);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", PROC_VERSION, e.getMessage());
        }
        return detectWsl(procVersion, System.getenv());
    }

    static boolean detectWsl(String procVersion, Map<String, String> env) {
        if (procVersion != null) {
            String kernel = procVersion.toLowerCase(Locale.ROOT);
            return kernel.contains("microsoft") || kernel.contains("wsl");
        }
        return firstNonBlank(env.get("WSL_DISTRO_NAME"), env.get("WSLENV")) != null;
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
