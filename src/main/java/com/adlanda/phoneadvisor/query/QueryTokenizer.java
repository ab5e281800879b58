package com.adlanda.phoneadvisor.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits free text into lower-case tokens for keyword and model-name matching.
 *
 * A token is a run of ASCII letters and digits, or a lone {@code +}, so "S25+" yields
 * {@code [s25, +]} and "Z Fold5, please" yields {@code [z, fold5, please]}.
 * Everything else is a separator. Model names typed without spaces are split the way
 * they are written in the catalog: "s24ultra" yields {@code [s24, ultra]} and "zflip6"
 * yields {@code [z, flip6]}.
 */
public final class QueryTokenizer {

    /** Variant suffixes that distinguish e.g. "S24 Ultra" from "S24". */
    public static final Set<String> SUFFIX_TOKENS = Set.of("ultra", "plus", "+", "fe");

    static final String BRAND_TOKEN = "samsung";
    static final String FAMILY_TOKEN = "galaxy";

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+|\\+");
    private static final Pattern ATTACHED_SUFFIX = Pattern.compile("(?<=\\d)(?=ultra|plus|fe\\b)");
    private static final Pattern ATTACHED_FOLDABLE = Pattern.compile("\\bz(?=fold|flip)");

    private QueryTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        lower = ATTACHED_SUFFIX.matcher(lower).replaceAll(" ");
        lower = ATTACHED_FOLDABLE.matcher(lower).replaceAll("z ");
        Matcher matcher = TOKEN.matcher(lower);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return List.copyOf(tokens);
    }

    /**
     * Tokenizes and drops the brand token, which the catalog and users apply inconsistently.
     */
    public static List<String> tokenizeWithoutBrand(String text) {
        return tokenize(text).stream()
                .filter(token -> !BRAND_TOKEN.equals(token))
                .toList();
    }

    /**
     * Canonical form of a variant suffix: {@code +} and {@code plus} are the same variant.
     */
    public static String normalizeSuffix(String suffix) {
        return "+".equals(suffix) ? "plus" : suffix;
    }

    public static boolean isSuffix(String token) {
        return SUFFIX_TOKENS.contains(token);
    }

    /**
     * Returns true when {@code keyword} occurs in {@code tokens}. A keyword may span several
     * words ("tell me about"); all words but the last must match whole tokens, the last
     * may be a prefix of its token so "spec" also finds "specs" and "photo" finds "photography".
     */
    public static boolean containsKeyword(List<String> tokens, String keyword) {
        String[] words = keyword.split(" ");
        int last = words.length - 1;
        for (int start = 0; start + last < tokens.size(); start++) {
            boolean matched = true;
            for (int i = 0; i < last && matched; i++) {
                matched = tokens.get(start + i).equals(words[i]);
            }
            if (matched && tokens.get(start + last).startsWith(words[last])) {
                return true;
            }
        }
        return false;
    }
}
