package com.adlanda.phoneadvisor.query;

import com.adlanda.phoneadvisor.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Resolves the model names a question refers to.
 *
 * Each catalog name is matched independently by the first rule that recognizes it:
 * full name (100), core name (95), series and suffix (90 / 30), foldable series (90 / 40).
 * Names at {@value #HIGH_CONFIDENCE} or above win; only when none reach it are weak
 * matches down to {@value #LOW_CONFIDENCE} returned.
 */
@Component
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    public static final int HIGH_CONFIDENCE = 80;
    public static final int LOW_CONFIDENCE = 30;

    private final List<NameMatchRule> rules;

    public EntityResolver() {
        this(List.of(new FullNameRule(), new CoreNameRule(), new SeriesSuffixRule(), new FoldableSeriesRule()));
    }

    public EntityResolver(List<NameMatchRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Resolves model names mentioned in the question.
     *
     * @param question   Free text
     * @param knownNames Catalog model names, in catalog order
     * @return Distinct model names, highest confidence first; empty when nothing is recognized
     */
    public List<String> resolveNames(String question, Collection<String> knownNames) {
        List<MatchCandidate> candidates = match(question, knownNames);

        List<String> resolved = select(candidates, HIGH_CONFIDENCE);
        if (resolved.isEmpty()) {
            resolved = select(candidates, LOW_CONFIDENCE);
        }

        log.debug("Resolved {} from {} candidates", resolved, candidates.size());
        return resolved;
    }

    /**
     * Scores every known name against the question.
     *
     * @return Matched candidates sorted by confidence descending, catalog order among equals
     */
    public List<MatchCandidate> match(String question, Collection<String> knownNames) {
        List<String> queryTokens = QueryTokenizer.tokenizeWithoutBrand(question);
        List<MatchCandidate> candidates = new ArrayList<>();

        for (String name : knownNames) {
            CandidateName candidate = CandidateName.of(name);
            for (NameMatchRule rule : rules) {
                OptionalInt confidence = rule.match(candidate, queryTokens);
                if (confidence.isPresent()) {
                    candidates.add(new MatchCandidate(name, confidence.getAsInt()));
                    break;
                }
            }
        }

        candidates.sort(Comparator.comparingInt(MatchCandidate::confidence).reversed());
        return candidates;
    }

    private List<String> select(List<MatchCandidate> sorted, int threshold) {
        Set<String> names = new LinkedHashSet<>();
        for (MatchCandidate candidate : sorted) {
            if (candidate.confidence() >= threshold) {
                names.add(candidate.modelName());
            }
        }
        return List.copyOf(names);
    }
}
