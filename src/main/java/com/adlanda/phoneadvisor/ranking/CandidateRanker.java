package com.adlanda.phoneadvisor.ranking;

import com.adlanda.phoneadvisor.model.CriteriaSet;
import com.adlanda.phoneadvisor.model.Focus;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.model.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Produces the recommendation shortlist: the best {@value #SHORTLIST_SIZE} records by
 * score. Equal scores keep their input order.
 */
@Component
public class CandidateRanker {

    public static final int SHORTLIST_SIZE = 3;

    private final CandidateScorer scorer;

    public CandidateRanker(CandidateScorer scorer) {
        this.scorer = scorer;
    }

    public List<ScoredCandidate> rank(List<PhoneRecord> records, Focus focus, CriteriaSet criteria) {
        // Stream.sorted is stable for ordered streams
        return records.stream()
                .map(record -> new ScoredCandidate(record, scorer.score(record, focus, criteria)))
                .sorted(Comparator.comparingDouble(ScoredCandidate::score).reversed())
                .limit(SHORTLIST_SIZE)
                .toList();
    }
}
