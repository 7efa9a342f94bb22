package io.github.drompincen.webdeck.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.webdeck.runtime.config.WebDeckProperties;
import io.github.drompincen.webdeck.runtime.exec.ExecutorRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorDiscoveryTest {

    @Test
    void serviceFileExecutorsAreDiscoveredAndWired() {
        WebDeckProperties properties = new WebDeckProperties(null, new WebDeckProperties.Shell("sh", null), null, null);
        WorkingDirectoryResolver resolver =
                new WorkingDirectoryResolver(new PathTranslator(false, Path.of("/")), List.of(Path.of("/")));
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.registerBean(WebDeckProperties.class, () -> properties);
            context.registerBean(ObjectMapper.class, () -> new ObjectMapper());
            context.registerBean(WorkingDirectoryResolver.class, () -> resolver);
            context.refresh();
            ExecutorRegistry registry = new ExecutorRegistry(context);

            registry.discover();

            assertThat(registry.names()).containsExactly("assistant", "shell");
            ShellCommandExecutor shell = (ShellCommandExecutor) registry.get("shell").orElseThrow();
            assertThat(shell.defaultShell()).isEqualTo(ShellKind.SH);
        }
    }
}
