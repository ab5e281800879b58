package com.adlanda.phoneadvisor.repository;

import com.adlanda.phoneadvisor.model.PhoneRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read access to the phone catalog. Implementations must tolerate concurrent readers;
 * callers never write through this interface.
 */
public interface PhoneCatalog {

    /**
     * All model names, in catalog order.
     */
    List<String> listAllNames();

    /**
     * Looks a record up by name: case-insensitive exact match first, then containment,
     * then containment after dropping the "samsung" and "galaxy" words.
     *
     * @return The first matching record in catalog order, or empty
     */
    Optional<PhoneRecord> getByExactOrSubstringName(String name);

    /**
     * Records whose parsed price is at most {@code maxPrice}, in catalog order.
     * Records without a parseable price are excluded.
     */
    List<PhoneRecord> filterByMaxPrice(double maxPrice);

    List<PhoneRecord> listAll();

    long count();

    /**
     * The secondary lookup key for a name: lower case without brand and family words.
     */
    static String withoutBrandWords(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replace("samsung", "")
                .replace("galaxy", "")
                .trim()
                .replaceAll("\\s+", " ");
    }
}
