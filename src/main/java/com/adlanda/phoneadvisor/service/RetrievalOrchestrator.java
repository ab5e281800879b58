package com.adlanda.phoneadvisor.service;

import com.adlanda.phoneadvisor.comparison.ComparisonDifferencer;
import com.adlanda.phoneadvisor.model.ComparisonResult;
import com.adlanda.phoneadvisor.model.CriteriaSet;
import com.adlanda.phoneadvisor.model.Intent;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.model.QueryAnalysis;
import com.adlanda.phoneadvisor.model.Recommendation;
import com.adlanda.phoneadvisor.model.RetrievalResult;
import com.adlanda.phoneadvisor.query.CriteriaExtractor;
import com.adlanda.phoneadvisor.query.EntityResolver;
import com.adlanda.phoneadvisor.ranking.CandidateRanker;
import com.adlanda.phoneadvisor.repository.PhoneCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a question into structured data.
 *
 * Orchestrates the retrieval flow:
 * 1. Classify intent and extract criteria
 * 2. Resolve mentioned model names
 * 3. Fetch records by name, else by price ceiling, else the whole catalog for recommendations
 * 4. Attach a comparison or a ranked shortlist
 */
@Service
public class RetrievalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    static final int PRICE_FILTER_LIMIT = 10;

    private final CriteriaExtractor criteriaExtractor;
    private final EntityResolver entityResolver;
    private final CandidateRanker ranker;
    private final ComparisonDifferencer differencer;
    private final PhoneCatalog catalog;

    public RetrievalOrchestrator(CriteriaExtractor criteriaExtractor,
                                 EntityResolver entityResolver,
                                 CandidateRanker ranker,
                                 ComparisonDifferencer differencer,
                                 PhoneCatalog catalog) {
        this.criteriaExtractor = criteriaExtractor;
        this.entityResolver = entityResolver;
        this.ranker = ranker;
        this.differencer = differencer;
        this.catalog = catalog;
    }

    public RetrievalResult retrieve(String question) {
        QueryAnalysis analysis = criteriaExtractor.classify(question);
        Intent intent = analysis.intent();
        CriteriaSet criteria = analysis.criteria();

        List<String> names = entityResolver.resolveNames(question, catalog.listAllNames());
        List<PhoneRecord> records = fetch(names, intent, criteria);

        ComparisonResult comparison = null;
        Recommendation recommendation = null;
        if (intent == Intent.COMPARISON && records.size() >= 2) {
            comparison = differencer.diff(records.get(0), records.get(1));
        } else if (intent == Intent.RECOMMENDATION) {
            recommendation = new Recommendation(criteria, records,
                    ranker.rank(records, criteria.effectiveFocus(), criteria));
        }

        log.debug("Question '{}': intent={}, criteria={}, names={}, records={}",
                truncate(question, 50), intent.label(), criteria, names, records.size());

        return new RetrievalResult(question, intent, criteria, records, comparison, recommendation);
    }

    private List<PhoneRecord> fetch(List<String> names, Intent intent, CriteriaSet criteria) {
        if (!names.isEmpty()) {
            List<PhoneRecord> records = new ArrayList<>();
            for (String name : names) {
                Optional<PhoneRecord> record = catalog.getByExactOrSubstringName(name);
                record.ifPresent(records::add);
            }
            return records;
        }
        if (criteria.hasPriceMax()) {
            return catalog.filterByMaxPrice(criteria.priceMax()).stream()
                    .limit(PRICE_FILTER_LIMIT)
                    .toList();
        }
        if (intent == Intent.RECOMMENDATION) {
            return catalog.listAll();
        }
        return List.of();
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
