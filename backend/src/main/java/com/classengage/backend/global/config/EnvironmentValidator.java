package com.classengage.backend.global.config;

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
 * Fails startup when required settings are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "spring.transaction.default-timeout"
    };

    private static final String[] POSITIVE_INT_KEYS = {
            "classengage.session.host-session-limit",
            "classengage.session.pending-question-limit",
            "classengage.session.max-code-attempts"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingKeys = new ArrayList<>();
        List<String> invalidKeys = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingKeys.add(key);
            }
        }

        for (String key : POSITIVE_INT_KEYS) {
            String raw = environment.getProperty(key);
            if (raw == null) {
                continue;
            }
            try {
                if (Integer.parseInt(raw.trim()) < 1) {
                    invalidKeys.add(key + ": must be >= 1");
                }
            } catch (NumberFormatException e) {
                invalidKeys.add(key + ": must be a number");
            }
        }

        String datasourceUrl = environment.getProperty("spring.datasource.url", "");
        if (!datasourceUrl.isBlank() && !datasourceUrl.startsWith("jdbc:postgresql:")) {
            invalidKeys.add("spring.datasource.url: only PostgreSQL is supported");
        }

        if (!missingKeys.isEmpty() || !invalidKeys.isEmpty()) {
            if (!missingKeys.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingKeys));
            }
            invalidKeys.forEach(v -> log.error("Invalid setting - {}", v));
            throw new IllegalStateException("Environment validation failed; see log for details");
        }

        log.info("Environment validation passed");
    }
}
