package com.adlanda.phoneadvisor.repository;

import com.adlanda.phoneadvisor.entity.PhoneEntity;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.ranking.SpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * PostgreSQL-backed catalog.
 *
 * This is a wrapper around {@link PhoneRepository} that hands out detached
 * {@link PhoneRecord} snapshots, so nothing above this layer touches managed entities.
 */
@Repository
@Transactional(readOnly = true)
public class JpaPhoneCatalog implements PhoneCatalog {

    private static final Logger log = LoggerFactory.getLogger(JpaPhoneCatalog.class);

    private final PhoneRepository repository;

    public JpaPhoneCatalog(PhoneRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<String> listAllNames() {
        return repository.findAllModelNames();
    }

    @Override
    public Optional<PhoneRecord> getByExactOrSubstringName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Optional<PhoneEntity> found = repository.findFirstByModelNameIgnoreCaseOrderByIdAsc(name.trim());
        if (found.isEmpty()) {
            found = repository.findFirstByModelNameContainingIgnoreCaseOrderByIdAsc(name.trim());
        }
        if (found.isEmpty()) {
            String reduced = PhoneCatalog.withoutBrandWords(name);
            if (!reduced.isEmpty()) {
                found = repository.findFirstByModelNameContainingIgnoreCaseOrderByIdAsc(reduced);
            }
        }
        if (found.isEmpty()) {
            log.debug("No phone found for name '{}'", name);
        }
        return found.map(PhoneEntity::toRecord);
    }

    @Override
    public List<PhoneRecord> filterByMaxPrice(double maxPrice) {
        return listAll().stream()
                .filter(record -> {
                    OptionalDouble price = SpecParser.price(record.price());
                    return price.isPresent() && price.getAsDouble() <= maxPrice;
                })
                .toList();
    }

    @Override
    public List<PhoneRecord> listAll() {
        return repository.findAllByOrderByIdAsc().stream()
                .map(PhoneEntity::toRecord)
                .toList();
    }

    @Override
    public long count() {
        return repository.count();
    }
}
