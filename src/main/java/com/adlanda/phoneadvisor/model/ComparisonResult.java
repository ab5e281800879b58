package com.adlanda.phoneadvisor.model;

import java.util.List;

/**
 * Side-by-side comparison of two records.
 *
 * @param recordA     First record, as listed in the question
 * @param recordB     Second record
 * @param differences Differing attributes in canonical order
 */
public record ComparisonResult(
        PhoneRecord recordA,
        PhoneRecord recordB,
        List<AttributeDifference> differences
) {
    public ComparisonResult {
        differences = List.copyOf(differences);
    }
}
