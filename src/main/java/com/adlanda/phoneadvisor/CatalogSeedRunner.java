package com.adlanda.phoneadvisor;

import com.adlanda.phoneadvisor.config.AdvisorProperties;
import com.adlanda.phoneadvisor.service.CatalogSeedService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Seeds the phone catalog on application startup.
 *
 * A missing or unreadable seed file is logged and the application keeps running with
 * whatever the database already holds.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class CatalogSeedRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeedRunner.class);

    private final CatalogSeedService seedService;
    private final AdvisorProperties properties;

    public CatalogSeedRunner(CatalogSeedService seedService, AdvisorProperties properties) {
        this.seedService = seedService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSeed().isEnabled()) {
            log.info("Catalog seeding disabled");
            return;
        }

        log.info("Seeding phone catalog from {}...", properties.getSeed().getLocation());
        try {
            seedService.seed();
        } catch (IOException e) {
            log.error("Failed to seed phone catalog: {}", e.getMessage(), e);
        }
    }
}
