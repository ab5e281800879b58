package com.adlanda.phoneadvisor.repository;

import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.ranking.SpecParser;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Predicate;

/**
 * Immutable list-backed catalog with the same lookup semantics as {@link JpaPhoneCatalog}.
 * Catalog order is list order. Safe for concurrent readers.
 */
public class InMemoryPhoneCatalog implements PhoneCatalog {

    private final List<PhoneRecord> records;

    public InMemoryPhoneCatalog(List<PhoneRecord> records) {
        this.records = List.copyOf(records);
    }

    @Override
    public List<String> listAllNames() {
        return records.stream().map(PhoneRecord::modelName).toList();
    }

    @Override
    public Optional<PhoneRecord> getByExactOrSubstringName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        Optional<PhoneRecord> found = first(record -> lower(record).equals(wanted));
        if (found.isEmpty()) {
            found = first(record -> lower(record).contains(wanted));
        }
        if (found.isEmpty()) {
            String reduced = PhoneCatalog.withoutBrandWords(name);
            if (!reduced.isEmpty()) {
                found = first(record -> lower(record).contains(reduced));
            }
        }
        return found;
    }

    @Override
    public List<PhoneRecord> filterByMaxPrice(double maxPrice) {
        return records.stream()
                .filter(record -> {
                    OptionalDouble price = SpecParser.price(record.price());
                    return price.isPresent() && price.getAsDouble() <= maxPrice;
                })
                .toList();
    }

    @Override
    public List<PhoneRecord> listAll() {
        return records;
    }

    @Override
    public long count() {
        return records.size();
    }

    private Optional<PhoneRecord> first(Predicate<PhoneRecord> predicate) {
        return records.stream().filter(predicate).findFirst();
    }

    private static String lower(PhoneRecord record) {
        return record.modelName().toLowerCase(Locale.ROOT);
    }
}
