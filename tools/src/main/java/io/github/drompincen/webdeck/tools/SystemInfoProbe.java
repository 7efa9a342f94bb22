package io.github.drompincen.webdeck.tools;

import io.github.drompincen.webdeck.protocol.api.ShellsResponse;
import io.github.drompincen.webdeck.protocol.api.SystemInfoDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;

public class SystemInfoProbe {

    private static final Logger log = LoggerFactory.getLogger(SystemInfoProbe.class);

    private final Map<String, String> env;
    private final String os;
    private final boolean wsl;
    private final Path home;

    public SystemInfoProbe(Map<String, String> env, String os, boolean wsl, Path home) {
        this.env = env;
        this.os = os;
        this.wsl = wsl;
        this.home = home;
    }

    public static SystemInfoProbe system() {
        return new SystemInfoProbe(System.getenv(), Platform.os(), Platform.isWsl(), Platform.homeDirectory());
    }

    public SystemInfoDto systemInfo() {
        String username = Platform.firstNonBlank(env.get("USER"), env.get("USERNAME"), env.get("LOGNAME"),
                System.getProperty("user.name"), "unknown");
        return new SystemInfoDto(username, hostname(), os, home.toString(),
                Path.of("").toAbsolutePath().toString(), wsl);
    }

    public ShellsResponse shells() {
        return new ShellsResponse(
                ShellKind.offeredOn(os).stream().map(ShellKind::executable).collect(Collectors.toList()),
                os,
                ShellKind.defaultOn(os).executable());
    }

    private String hostname() {
        String fromEnv = Platform.firstNonBlank(env.get("HOSTNAME"), env.get("COMPUTERNAME"));
        if (fromEnv != null) {
            return fromEnv;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve local hostname: {}", e.getMessage());
            return "localhost";
        }
    }
}
