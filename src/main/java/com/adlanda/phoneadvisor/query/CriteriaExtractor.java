package com.adlanda.phoneadvisor.query;

import com.adlanda.phoneadvisor.model.CriteriaSet;
import com.adlanda.phoneadvisor.model.Focus;
import com.adlanda.phoneadvisor.model.Intent;
import com.adlanda.phoneadvisor.model.QueryAnalysis;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a question into an {@link Intent} and extracts its {@link CriteriaSet}.
 *
 * Intent categories are checked in a fixed order and the first category with a keyword
 * present wins. Focus groups are checked battery, camera, display, and the last group
 * with a hit wins, so "camera and screen" yields {@link Focus#DISPLAY}.
 */
@Component
public class CriteriaExtractor {

    private static final Map<Intent, List<String>> INTENT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<Focus, List<String>> FOCUS_KEYWORDS = new LinkedHashMap<>();

    static {
        INTENT_KEYWORDS.put(Intent.COMPARISON, List.of("compare", "versus", "vs", "difference", "better"));
        INTENT_KEYWORDS.put(Intent.RECOMMENDATION, List.of("best", "recommend", "which", "should i", "top"));
        INTENT_KEYWORDS.put(Intent.SPECS, List.of("spec", "feature", "detail", "what is", "what are", "tell me about"));

        FOCUS_KEYWORDS.put(Focus.BATTERY, List.of("battery", "long lasting"));
        FOCUS_KEYWORDS.put(Focus.CAMERA, List.of("camera", "photo"));
        FOCUS_KEYWORDS.put(Focus.DISPLAY, List.of("display", "screen"));
    }

    private static final Pattern PRICE_CEILING =
            Pattern.compile("\\b(?:under|below)\\s*\\$?\\s*(\\d[\\d,]*(?:\\.\\d+)?)");

    public QueryAnalysis classify(String question) {
        List<String> tokens = QueryTokenizer.tokenize(question);
        return new QueryAnalysis(
                detectIntent(tokens),
                new CriteriaSet(extractPriceMax(question), detectFocus(tokens))
        );
    }

    Intent detectIntent(List<String> tokens) {
        for (Map.Entry<Intent, List<String>> entry : INTENT_KEYWORDS.entrySet()) {
            if (containsAny(tokens, entry.getValue())) {
                return entry.getKey();
            }
        }
        return Intent.GENERAL;
    }

    Focus detectFocus(List<String> tokens) {
        Focus focus = null;
        for (Map.Entry<Focus, List<String>> entry : FOCUS_KEYWORDS.entrySet()) {
            if (containsAny(tokens, entry.getValue())) {
                focus = entry.getKey();
            }
        }
        return focus;
    }

    /**
     * Reads the first "under $N" / "below $N" ceiling in the question.
     */
    Double extractPriceMax(String question) {
        if (question == null) {
            return null;
        }
        Matcher matcher = PRICE_CEILING.matcher(question.toLowerCase(Locale.ROOT));
        if (!matcher.find()) {
            return null;
        }
        return Double.valueOf(matcher.group(1).replace(",", ""));
    }

    private static boolean containsAny(List<String> tokens, List<String> keywords) {
        for (String keyword : keywords) {
            if (QueryTokenizer.containsKeyword(tokens, keyword)) {
                return true;
            }
        }
        return false;
    }
}
