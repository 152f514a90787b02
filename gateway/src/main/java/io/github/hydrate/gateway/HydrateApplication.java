package io.github.hydrate.gateway;

import io.github.hydrate.runtime.config.HydrateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.hydrate")
@EnableConfigurationProperties(HydrateProperties.class)
@EnableScheduling
public class HydrateApplication {

    public static void main(String[] args) {
        SpringApplication.run(HydrateApplication.class, args);
    }
}
