package com.prmanager.backend.global.config;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or malformed.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "server.port"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is missing");
            }
        }

        return problems;
    }
}
