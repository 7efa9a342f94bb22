package io.github.drompincen.webdeck.tools;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites client-supplied paths into paths valid on this host. Clients may run on
 * Windows or macOS while the server runs under WSL, so drive letters, WSL network
 * shares and macOS home folders are mapped onto the Linux filesystem.
 */
public class PathTranslator {

    private static final Pattern DRIVE_PATH = Pattern.compile("^([A-Za-z]):[\\\\/](.*)$");
    private static final Pattern WSL_SHARE = Pattern.compile(
            "^\\\\\\\\wsl(?:\\$|\\.localhost)\\\\[^\\\\]+(.*)$", Pattern.CASE_INSENSITIVE);

    private final boolean wsl;
    private final Path home;

    public PathTranslator(boolean wsl, Path home) {
        this.wsl = wsl;
        this.home = home;
    }

    public static PathTranslator system() {
        return new PathTranslator(Platform.isWsl(), Platform.homeDirectory());
    }

    public boolean isWsl() { return wsl; }

    public Path home() { return home; }

    public String translate(String input) {
        String path = input.trim();
        if (path.equals("~") || path.equals("~/")) {
            return home.toString();
        }
        if (path.startsWith("~/")) {
            return home + path.substring(1);
        }
        if (!wsl) {
            return path;
        }

        Matcher share = WSL_SHARE.matcher(path);
        if (share.matches()) {
            String rest = share.group(1).replace('\\', '/');
            return rest.isEmpty() ? "/" : rest;
        }
        Matcher drive = DRIVE_PATH.matcher(path);
        if (drive.matches()) {
            char letter = Character.toLowerCase(drive.group(1).charAt(0));
            return "/mnt/" + letter + "/" + drive.group(2).replace('\\', '/');
        }
        if (path.startsWith("/Users/")) {
            return "/home/" + path.substring("/Users/".length());
        }
        return path;
    }
}
