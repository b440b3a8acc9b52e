package com.grokpm.backend.global.config;

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
 * Fails startup when required settings are missing.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.cors.allowed-origins",
            "server.port"
    };

    private final Environment environment;
    private final AppProperties appProperties;

    public EnvironmentValidator(Environment environment, AppProperties appProperties) {
        this.environment = environment;
        this.appProperties = appProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = findMissingProperties();
        if (!missing.isEmpty()) {
            log.error("Missing required configuration: {}", String.join(", ", missing));
            throw new IllegalStateException("Missing required configuration: " + String.join(", ", missing));
        }

        String port = environment.getProperty("server.port");
        try {
            int value = Integer.parseInt(port.trim());
            if (value < 0 || value > 65535) {
                throw new IllegalStateException("server.port out of range: " + port);
            }
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("server.port must be numeric: " + port, ex);
        }

        if (!appProperties.getPayments().isConfigured()) {
            log.info("Payments secret key not configured; subscription billing runs without a provider");
        }
        log.info("Environment validated (CORS origins: {}, seeding enabled: {})",
                appProperties.getCors().getAllowedOrigins(), appProperties.getSeed().isEnabled());
    }

    List<String> findMissingProperties() {
        List<String> missing = new ArrayList<>();
        for (String name : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(name));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missing.add(name);
            }
        }
        return missing;
    }
}
