package com.adlanda.phoneadvisor.query;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Recognizes bar-phone series names of the shape {@code <letter><number> [ultra|plus|+|fe]},
 * optionally followed by a "5g" tag, e.g. "s24 ultra", "s25 +", "a54 5g".
 *
 * The model number must appear in the question and the variant suffix must agree:
 * <ul>
 *   <li>same suffix, or both without one: {@value #EXACT_CONFIDENCE}</li>
 *   <li>question has no suffix, candidate has one: {@value #WEAK_CONFIDENCE}</li>
 *   <li>question names a suffix the candidate lacks: no match</li>
 * </ul>
 */
public class SeriesSuffixRule implements NameMatchRule {

    public static final int EXACT_CONFIDENCE = 90;
    public static final int WEAK_CONFIDENCE = 30;

    private static final Pattern MODEL_NUMBER = Pattern.compile("[sazn]\\d+");
    private static final String CONNECTIVITY_TAG = "5g";

    @Override
    public OptionalInt match(CandidateName candidate, List<String> queryTokens) {
        SeriesName series = parse(candidate.coreTokens());
        if (series == null) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < queryTokens.size(); i++) {
            if (!queryTokens.get(i).equals(series.modelNumber())) {
                continue;
            }
            String querySuffix = suffixAt(queryTokens, i + 1);
            if (querySuffix.equals(series.suffix())) {
                return OptionalInt.of(EXACT_CONFIDENCE);
            }
            if (querySuffix.isEmpty()) {
                return OptionalInt.of(WEAK_CONFIDENCE);
            }
            // the question names another variant of this model number; keep looking
        }
        return OptionalInt.empty();
    }

    /**
     * Parses a core token list into model number and normalized suffix, or null when the
     * name does not have the series shape.
     */
    static SeriesName parse(List<String> coreTokens) {
        int end = coreTokens.size();
        if (end > 1 && CONNECTIVITY_TAG.equals(coreTokens.get(end - 1))) {
            end--;
        }
        if (end < 1 || end > 2 || !MODEL_NUMBER.matcher(coreTokens.get(0)).matches()) {
            return null;
        }
        String suffix = "";
        if (end == 2) {
            if (!QueryTokenizer.isSuffix(coreTokens.get(1))) {
                return null;
            }
            suffix = QueryTokenizer.normalizeSuffix(coreTokens.get(1));
        }
        return new SeriesName(coreTokens.get(0), suffix);
    }

    private static String suffixAt(List<String> tokens, int index) {
        if (index < tokens.size() && QueryTokenizer.isSuffix(tokens.get(index))) {
            return QueryTokenizer.normalizeSuffix(tokens.get(index));
        }
        return "";
    }

    record SeriesName(String modelNumber, String suffix) {}
}
