package com.seatwise.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails fast at startup when a required property is missing or obviously unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins",
            "seatwise.change-log.history-max-limit"
    };

    private static final String PLACEHOLDER_SECRET = "dev-jwt-secret-key-change-in-production";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid environment: " + String.join(", ", problems));
        }
        log.info("Environment check passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        boolean activeProd = List.of(environment.getActiveProfiles()).contains("prod");
        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (activeProd && jwtSecret.filter(secret -> secret.startsWith(PLACEHOLDER_SECRET)).isPresent()) {
            problems.add("jwt.secret still uses the development placeholder");
        }

        String historyLimit = environment.getProperty("seatwise.change-log.history-max-limit");
        if (historyLimit != null && !historyLimit.isBlank()) {
            try {
                int limit = Integer.parseInt(historyLimit.trim());
                if (limit < 1 || limit > 1000) {
                    problems.add("seatwise.change-log.history-max-limit must be within 1-1000");
                }
            } catch (NumberFormatException e) {
                problems.add("seatwise.change-log.history-max-limit must be a number");
            }
        }
        return problems;
    }
}
