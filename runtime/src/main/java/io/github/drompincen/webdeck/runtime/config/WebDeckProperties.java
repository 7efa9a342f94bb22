package io.github.drompincen.webdeck.runtime.config;

import io.github.drompincen.webdeck.runtime.ratelimit.RateLimitPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code webdeck} prefix. Every unset value falls back to its default.
 */
@ConfigurationProperties(prefix = "webdeck")
public record WebDeckProperties(
        Assistant assistant,
        Shell shell,
        Auth auth,
        RateLimit rateLimit
) {
    public WebDeckProperties {
        if (assistant == null) assistant = new Assistant(null, null, null);
        if (shell == null) shell = new Shell(null, null);
        if (auth == null) auth = new Auth(null, null, null, null, null, null, null);
        if (rateLimit == null) rateLimit = new RateLimit(null, null, null, null);
    }

    public static WebDeckProperties defaults() {
        return new WebDeckProperties(null, null, null, null);
    }

    /**
     * @param executable name or absolute path of the assistant CLI
     * @param killGrace  time between the polite stop and the forced kill
     * @param probeTimeout time allowed for the startup version probe
     */
    public record Assistant(String executable, Duration killGrace, Duration probeTimeout) {
        public Assistant {
            if (executable == null || executable.isBlank()) executable = "claude";
            if (killGrace == null) killGrace = Duration.ofSeconds(3);
            if (probeTimeout == null) probeTimeout = Duration.ofSeconds(10);
        }
    }

    public record Shell(String defaultShell, Duration killGrace) {
        public Shell {
            if (defaultShell == null || defaultShell.isBlank()) defaultShell = "bash";
            if (killGrace == null) killGrace = Duration.ofSeconds(2);
        }
    }

    public record Auth(
            String jwtSecret,
            Duration tokenTtl,
            Integer codeLength,
            Duration codeTtl,
            Duration registrationTtl,
            Duration verifyTimeout,
            Boolean allowLocalhost
    ) {
        public Auth {
            if (tokenTtl == null) tokenTtl = Duration.ofDays(30);
            if (codeLength == null) codeLength = 6;
            if (codeTtl == null) codeTtl = Duration.ofMinutes(5);
            if (registrationTtl == null) registrationTtl = Duration.ofMinutes(10);
            if (verifyTimeout == null) verifyTimeout = Duration.ofMinutes(5);
            if (allowLocalhost == null) allowLocalhost = Boolean.TRUE;
        }
    }

    /**
     * @param trustForwardedHeaders key clients by {@code X-Forwarded-For}/{@code X-Real-IP};
     *                              only safe behind a proxy that overwrites them
     */
    public record RateLimit(RateLimitPolicy write, RateLimitPolicy read, RateLimitPolicy stream,
                            Boolean trustForwardedHeaders) {
        public RateLimit {
            if (write == null) write = RateLimitPolicy.perMinute(10);
            if (read == null) read = RateLimitPolicy.perMinute(20);
            if (stream == null) stream = RateLimitPolicy.perMinute(60);
            if (trustForwardedHeaders == null) trustForwardedHeaders = Boolean.FALSE;
        }
    }
}
