package io.github.drompincen.webdeck.gateway.config;

import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import io.github.drompincen.webdeck.tools.AssistantCliProbe;
import io.github.drompincen.webdeck.tools.ExecutableLocator;
import io.github.drompincen.webdeck.tools.SystemInfoProbe;
import io.github.drompincen.webdeck.tools.WorkingDirectoryResolver;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Host-facing helpers shared by the controllers and the SPI-loaded executors.
 */
@Configuration
public class WebDeckConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    WorkingDirectoryResolver workingDirectoryResolver() {
        return WorkingDirectoryResolver.system();
    }

    @Bean
    ExecutableLocator executableLocator() {
        return ExecutableLocator.system();
    }

    @Bean
    SystemInfoProbe systemInfoProbe() {
        return SystemInfoProbe.system();
    }

    @Bean
    AssistantCliProbe assistantCliProbe(ExecutableLocator executableLocator, WebDeckProperties properties) {
        return new AssistantCliProbe(executableLocator, properties.assistant().executable(),
                properties.assistant().probeTimeout());
    }

    @Bean
    ApplicationRunner assistantCliCheck(AssistantCliProbe probe) {
        return args -> probe.probeVersion();
    }
}
