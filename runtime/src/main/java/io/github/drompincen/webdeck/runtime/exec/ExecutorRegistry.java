package io.github.drompincen.webdeck.runtime.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executors by name. Implementations listed under {@code META-INF/services} are created by
 * {@link ServiceLoader}, so their collaborators arrive through setters wired by type.
 */
@Component
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);
    private final Map<String, StreamingExecutor> executors = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ExecutorRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void discover() {
        for (StreamingExecutor executor : ServiceLoader.load(StreamingExecutor.class, getClass().getClassLoader())) {
            wire(executor);
            register(executor);
        }
        log.info("Streaming executors available: {}", names());
    }

    public void register(StreamingExecutor executor) {
        StreamingExecutor previous = executors.put(executor.name(), executor);
        if (previous != null && previous != executor) {
            log.warn("Executor {} replaced {} with {}", executor.name(),
                    previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        }
    }

    /** Fills setters whose type has a bean; the rest keep their defaults. */
    void wire(StreamingExecutor executor) {
        applicationContext.getAutowireCapableBeanFactory()
                .autowireBeanProperties(executor, AutowireCapableBeanFactory.AUTOWIRE_BY_TYPE, false);
    }

    public Optional<StreamingExecutor> get(String name) {
        return Optional.ofNullable(executors.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(executors.keySet());
    }
}
