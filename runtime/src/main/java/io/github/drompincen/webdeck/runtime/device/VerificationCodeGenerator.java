package io.github.drompincen.webdeck.runtime.device;

import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/** Numeric one-time codes shown to the operator at registration. */
@Component
public class VerificationCodeGenerator {

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public VerificationCodeGenerator(WebDeckProperties properties) {
        this.length = properties.auth().codeLength();
    }

    public String next() {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(random.nextInt(10));
        }
        return code.toString();
    }
}
