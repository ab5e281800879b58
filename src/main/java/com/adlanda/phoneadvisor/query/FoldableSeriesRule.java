package com.adlanda.phoneadvisor.query;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes Z Fold / Z Flip names, written either "z fold 6" or "z fold6", with an
 * optional "fe" or "special" variant tag.
 *
 * The first mention of the candidate's series in the question decides the outcome:
 * same generation and variant scores {@value #EXACT_CONFIDENCE}; same generation with no
 * variant in the question while the candidate has one scores {@value #AMBIGUOUS_CONFIDENCE}.
 */
public class FoldableSeriesRule implements NameMatchRule {

    public static final int EXACT_CONFIDENCE = 90;
    public static final int AMBIGUOUS_CONFIDENCE = 40;

    private static final Pattern SERIES = Pattern.compile("(fold|flip)(\\d*)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Set<String> VARIANTS = Set.of("fe", "special");

    @Override
    public OptionalInt match(CandidateName candidate, List<String> queryTokens) {
        List<String> core = candidate.coreTokens();
        FoldName name = parseAt(core, 0);
        if (name == null || name.end() != core.size()) {
            return OptionalInt.empty();
        }
        FoldName mentioned = firstMention(queryTokens, name.series());
        if (mentioned == null || !mentioned.generation().equals(name.generation())) {
            return OptionalInt.empty();
        }
        if (mentioned.variant().equals(name.variant())) {
            return OptionalInt.of(EXACT_CONFIDENCE);
        }
        if (mentioned.variant().isEmpty()) {
            return OptionalInt.of(AMBIGUOUS_CONFIDENCE);
        }
        return OptionalInt.empty();
    }

    private static FoldName firstMention(List<String> tokens, String series) {
        for (int i = 0; i < tokens.size(); i++) {
            FoldName parsed = parseAt(tokens, i);
            if (parsed != null && parsed.series().equals(series)) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Parses a fold/flip name starting at {@code start}, or returns null.
     */
    static FoldName parseAt(List<String> tokens, int start) {
        if (start + 1 >= tokens.size() || !"z".equals(tokens.get(start))) {
            return null;
        }
        Matcher series = SERIES.matcher(tokens.get(start + 1));
        if (!series.matches()) {
            return null;
        }
        String generation = series.group(2);
        int next = start + 2;
        if (generation.isEmpty() && next < tokens.size() && DIGITS.matcher(tokens.get(next)).matches()) {
            generation = tokens.get(next++);
        }
        String variant = "";
        if (next < tokens.size() && VARIANTS.contains(tokens.get(next))) {
            variant = tokens.get(next++);
        }
        return new FoldName(series.group(1), generation, variant, next);
    }

    record FoldName(String series, String generation, String variant, int end) {}
}
