package io.github.drompincen.webdeck.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.webdeck")
@ConfigurationPropertiesScan(basePackages = "io.github.drompincen.webdeck.runtime.config")
@EnableMongoRepositories(basePackages = "io.github.drompincen.webdeck.persistence.repository")
@EnableScheduling
public class WebDeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebDeckApplication.class, args);
    }
}
