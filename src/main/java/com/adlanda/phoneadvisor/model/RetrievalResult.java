package com.adlanda.phoneadvisor.model;

import java.util.List;
import java.util.Optional;

/**
 * Structured outcome of retrieval for one question, handed to the answer renderer.
 *
 * @param question       The original question
 * @param intent         Classified intent
 * @param criteria       Extracted criteria
 * @param records        Fetched records, in resolver or catalog order
 * @param comparison     Present for comparison questions with two or more records
 * @param recommendation Present for recommendation questions
 */
public record RetrievalResult(
        String question,
        Intent intent,
        CriteriaSet criteria,
        List<PhoneRecord> records,
        ComparisonResult comparison,
        Recommendation recommendation
) {
    public RetrievalResult {
        records = List.copyOf(records);
    }

    public Optional<ComparisonResult> comparisonIfPresent() {
        return Optional.ofNullable(comparison);
    }

    public Optional<Recommendation> recommendationIfPresent() {
        return Optional.ofNullable(recommendation);
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}
