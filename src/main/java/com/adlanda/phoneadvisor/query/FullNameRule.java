package com.adlanda.phoneadvisor.query;

import java.util.List;

/**
 * The full model name ("galaxy s23 ultra") appears verbatim in the question.
 */
public class FullNameRule extends TokenSequenceRule {

    public static final int CONFIDENCE = 100;

    public FullNameRule() {
        super(CONFIDENCE);
    }

    @Override
    protected List<String> sequenceOf(CandidateName candidate) {
        return candidate.fullTokens();
    }
}
