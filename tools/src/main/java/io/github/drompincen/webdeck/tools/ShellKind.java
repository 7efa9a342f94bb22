package io.github.drompincen.webdeck.tools;

import java.util.List;
import java.util.Locale;

public enum ShellKind {
    BASH("bash"),
    SH("sh"),
    ZSH("zsh"),
    FISH("fish"),
    CMD("cmd"),
    POWERSHELL("powershell");

    private final String executable;

    ShellKind(String executable) {
        this.executable = executable;
    }

    public String executable() { return executable; }

    public List<String> commandLine(String command) {
        switch (this) {
            case CMD:
                return List.of(executable, "/c", command);
            case POWERSHELL:
                return List.of(executable, "-Command", command);
            default:
                return List.of(executable, "-c", command);
        }
    }

    public static ShellKind fromName(String name, ShellKind fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        for (ShellKind kind : values()) {
            if (kind.executable.equals(name.trim().toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        return BASH;
    }

    /** Shells offered to clients for the given {@link Platform#os()} value. */
    public static List<ShellKind> offeredOn(String os) {
        switch (os) {
            case "windows":
                return List.of(CMD, POWERSHELL, BASH);
            case "linux":
            case "darwin":
                return List.of(BASH, SH, ZSH, FISH);
            default:
                return List.of(BASH, SH);
        }
    }

    public static ShellKind defaultOn(String os) {
        return "windows".equals(os) ? CMD : BASH;
    }
}
