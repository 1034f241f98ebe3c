package com.matchmate.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
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
 * Fails startup when required configuration is missing or malformed.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "matchmate.session.ttl",
            "matchmate.discovery.scan-limit",
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
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            if (read(key).isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        read("matchmate.session.ttl").ifPresent(raw -> {
            try {
                Duration ttl = Duration.parse(raw);
                if (ttl.isNegative() || ttl.isZero()) {
                    problems.add("matchmate.session.ttl must be positive");
                }
            } catch (DateTimeParseException e) {
                problems.add("matchmate.session.ttl must be an ISO-8601 duration such as P7D");
            }
        });

        read("matchmate.discovery.scan-limit").ifPresent(raw -> {
            try {
                if (Integer.parseInt(raw) < 1) {
                    problems.add("matchmate.discovery.scan-limit must be at least 1");
                }
            } catch (NumberFormatException e) {
                problems.add("matchmate.discovery.scan-limit must be a number");
            }
        });
        return problems;
    }

    private Optional<String> read(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
