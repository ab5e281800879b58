package com.adlanda.phoneadvisor.query;

import java.util.List;

/**
 * The model name without the "galaxy" family ("s23 ultra") appears verbatim in the question.
 */
public class CoreNameRule extends TokenSequenceRule {

    public static final int CONFIDENCE = 95;

    public CoreNameRule() {
        super(CONFIDENCE);
    }

    @Override
    protected List<String> sequenceOf(CandidateName candidate) {
        return candidate.coreTokens();
    }
}
