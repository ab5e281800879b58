package com.adlanda.phoneadvisor.query;

import java.util.List;

/**
 * A catalog model name prepared for matching.
 *
 * @param modelName  Name exactly as stored in the catalog
 * @param fullTokens Name tokens without the brand token, e.g. {@code [galaxy, s24, ultra]}
 * @param coreTokens Full tokens without the family token, e.g. {@code [s24, ultra]}
 */
public record CandidateName(String modelName, List<String> fullTokens, List<String> coreTokens) {

    public static CandidateName of(String modelName) {
        List<String> full = QueryTokenizer.tokenizeWithoutBrand(modelName);
        List<String> core = full.stream()
                .filter(token -> !QueryTokenizer.FAMILY_TOKEN.equals(token))
                .toList();
        return new CandidateName(modelName, full, core);
    }
}
