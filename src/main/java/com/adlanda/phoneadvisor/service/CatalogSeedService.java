package com.adlanda.phoneadvisor.service;

import com.adlanda.phoneadvisor.config.AdvisorProperties;
import com.adlanda.phoneadvisor.entity.PhoneEntity;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.repository.PhoneRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the bundled phone catalog into the database.
 *
 * Seeding is additive: records whose model name is already stored are skipped, so it is
 * safe to run on every startup.
 */
@Service
public class CatalogSeedService {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeedService.class);

    private final PhoneRepository repository;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final AdvisorProperties properties;

    public CatalogSeedService(PhoneRepository repository,
                              ObjectMapper objectMapper,
                              ResourceLoader resourceLoader,
                              AdvisorProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    /**
     * Seeds from the configured location.
     *
     * @return Counts of inserted and skipped records
     * @throws IOException If the seed file is missing or malformed
     */
    @Transactional
    public SeedSummary seed() throws IOException {
        String location = properties.getSeed().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Seed file not found: " + location);
        }
        return seed(read(resource));
    }

    /**
     * Inserts the records that are not yet stored.
     */
    @Transactional
    public SeedSummary seed(List<PhoneRecord> records) {
        int inserted = 0;
        int skipped = 0;

        for (PhoneRecord record : records) {
            if (record.modelName() == null || record.modelName().isBlank()) {
                log.warn("Skipping seed record without model name");
                skipped++;
                continue;
            }
            if (repository.existsByModelNameIgnoreCase(record.modelName())) {
                log.debug("Skipped (exists): {}", record.modelName());
                skipped++;
                continue;
            }
            repository.save(PhoneEntity.from(record));
            inserted++;
        }

        log.info("Catalog seed complete: {} inserted, {} skipped", inserted, skipped);
        return new SeedSummary(inserted, skipped);
    }

    /**
     * Reads a JSON array of phone records.
     */
    public List<PhoneRecord> read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<PhoneRecord>>() {});
        }
    }

    /**
     * Outcome of a seed run.
     */
    public record SeedSummary(int inserted, int skipped) {}
}
