package com.adlanda.phoneadvisor.model;

import java.util.List;

/**
 * Ranked shortlist produced for a recommendation question.
 *
 * @param criteria   Criteria the candidates were scored against
 * @param candidates Every record that was scored
 * @param topPicks   At most three best-scoring candidates, best first
 */
public record Recommendation(
        CriteriaSet criteria,
        List<PhoneRecord> candidates,
        List<ScoredCandidate> topPicks
) {
    public Recommendation {
        candidates = List.copyOf(candidates);
        topPicks = List.copyOf(topPicks);
    }

    public List<PhoneRecord> topPickRecords() {
        return topPicks.stream().map(ScoredCandidate::record).toList();
    }
}
