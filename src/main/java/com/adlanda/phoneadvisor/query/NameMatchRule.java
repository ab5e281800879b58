package com.adlanda.phoneadvisor.query;

import java.util.List;
import java.util.OptionalInt;

/**
 * One deterministic way of recognizing a catalog model name in a question.
 */
public interface NameMatchRule {

    /**
     * Matches a candidate against the question tokens.
     *
     * @param candidate   The prepared catalog name
     * @param queryTokens Question tokens with the brand token removed
     * @return The match confidence, or empty when this rule does not recognize the name
     */
    OptionalInt match(CandidateName candidate, List<String> queryTokens);
}
