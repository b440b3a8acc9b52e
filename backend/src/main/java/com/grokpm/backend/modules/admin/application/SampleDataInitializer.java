package com.grokpm.backend.modules.admin.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds the sample data set once the context is up. Disabled with {@code app.seed.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SampleDataInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SampleDataInitializer.class);

    private final SampleDataService sampleDataService;

    public SampleDataInitializer(SampleDataService sampleDataService) {
        this.sampleDataService = sampleDataService;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean seeded = sampleDataService.seedIfEmpty();
        log.info("Startup seeding finished (seeded={})", seeded);
    }
}
