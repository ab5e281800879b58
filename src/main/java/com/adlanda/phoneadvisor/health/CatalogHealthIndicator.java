package com.adlanda.phoneadvisor.health;

import com.adlanda.phoneadvisor.repository.PhoneCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the phone catalog.
 *
 * Reports the number of phones available to answer questions. An empty catalog is still
 * UP, since the advisor then answers with its "no phones found" message.
 */
@Component
public class CatalogHealthIndicator implements HealthIndicator {

    private final PhoneCatalog catalog;

    public CatalogHealthIndicator(PhoneCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        try {
            long count = catalog.count();
            return Health.up()
                    .withDetail("phoneCount", count)
                    .withDetail("status", count > 0 ? "seeded" : "empty")
                    .build();
        } catch (DataAccessException e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("phoneCount", 0)
                    .build();
        }
    }
}
