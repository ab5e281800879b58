package com.adlanda.phoneadvisor.query;

import java.util.List;
import java.util.OptionalInt;

/**
 * Matches when a token sequence taken from the candidate name appears contiguously in the
 * question and is not directly followed by a variant suffix the candidate lacks.
 * "galaxy s24" therefore does not match "galaxy s24 ultra".
 */
abstract class TokenSequenceRule implements NameMatchRule {

    private final int confidence;

    protected TokenSequenceRule(int confidence) {
        this.confidence = confidence;
    }

    protected abstract List<String> sequenceOf(CandidateName candidate);

    @Override
    public OptionalInt match(CandidateName candidate, List<String> queryTokens) {
        List<String> sequence = sequenceOf(candidate);
        if (sequence.isEmpty()) {
            return OptionalInt.empty();
        }
        int length = sequence.size();
        for (int start = 0; start + length <= queryTokens.size(); start++) {
            if (queryTokens.subList(start, start + length).equals(sequence)
                    && !followedByForeignSuffix(queryTokens, start + length, sequence)) {
                return OptionalInt.of(confidence);
            }
        }
        return OptionalInt.empty();
    }

    private boolean followedByForeignSuffix(List<String> queryTokens, int next, List<String> sequence) {
        if (next >= queryTokens.size()) {
            return false;
        }
        String following = queryTokens.get(next);
        return QueryTokenizer.isSuffix(following) && !sequence.contains(following);
    }
}
