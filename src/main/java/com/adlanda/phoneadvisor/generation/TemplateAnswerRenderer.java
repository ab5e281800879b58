package com.adlanda.phoneadvisor.generation;

import com.adlanda.phoneadvisor.model.ComparisonResult;
import com.adlanda.phoneadvisor.model.CriteriaSet;
import com.adlanda.phoneadvisor.model.Focus;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.model.Recommendation;
import com.adlanda.phoneadvisor.model.RetrievalResult;
import com.adlanda.phoneadvisor.query.QueryTokenizer;
import com.adlanda.phoneadvisor.ranking.CandidateRanker;
import com.adlanda.phoneadvisor.ranking.SpecParser;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Deterministic per-intent answers, used whenever no chat model produced one.
 */
@Component
public class TemplateAnswerRenderer {

    public static final String NO_PHONES_FOUND =
            "I couldn't find any Samsung phones matching your query. Please try rephrasing your question "
                    + "or ask about specific models like Galaxy S24 Ultra, S23, A54, etc.";

    public static final String ASK_FOR_MODEL =
            "Please ask about specific Samsung phone models or describe what you're looking for.";

    private static final String NOT_AVAILABLE = "N/A";
    private static final String BULLET = "• ";

    public String render(RetrievalResult result) {
        List<PhoneRecord> records = result.records();
        switch (result.intent()) {
            case SPECS:
                return records.isEmpty() ? NO_PHONES_FOUND : renderSpecs(records.get(0));
            case COMPARISON:
                return renderComparison(result);
            case RECOMMENDATION:
                return renderRecommendation(result);
            default:
                return renderGeneral(result);
        }
    }

    public String noPhonesFound() {
        return NO_PHONES_FOUND;
    }

    String renderSpecs(PhoneRecord phone) {
        return phone.modelName() + " specifications:\n\n"
                + BULLET + "Display: " + valueOrNa(phone.display()) + "\n"
                + BULLET + "Battery: " + valueOrNa(phone.battery()) + "\n"
                + BULLET + "Camera: " + valueOrNa(phone.camera()) + "\n"
                + BULLET + "RAM: " + valueOrNa(phone.ram()) + "\n"
                + BULLET + "Storage: " + valueOrNa(phone.storage()) + "\n"
                + BULLET + "Chipset: " + valueOrNa(phone.chipset()) + "\n"
                + BULLET + "OS: " + valueOrNa(phone.os()) + "\n"
                + BULLET + "Price: " + valueOrNa(phone.price()) + "\n"
                + BULLET + "Released: " + valueOrNa(phone.releaseDate());
    }

    String renderComparison(RetrievalResult result) {
        if (result.comparison() == null) {
            return result.records().size() == 1 ? renderSpecs(result.records().get(0)) : NO_PHONES_FOUND;
        }
        ComparisonResult comparison = result.comparison();
        PhoneRecord a = comparison.recordA();
        PhoneRecord b = comparison.recordB();

        StringBuilder sb = new StringBuilder();
        sb.append("Comparing ").append(a.modelName()).append(" vs ").append(b.modelName()).append(":\n\n");
        appendSideBySide(sb, "Display", a, b, PhoneRecord::display);
        appendSideBySide(sb, "Battery", a, b, PhoneRecord::battery);
        appendSideBySide(sb, "Camera", a, b, PhoneRecord::camera);
        appendSideBySide(sb, "Price", a, b, PhoneRecord::price);
        sb.append("Recommendation:\n").append(comparisonVerdict(a, b, result.criteria().effectiveFocus(), result.question()));
        return sb.toString();
    }

    String renderRecommendation(RetrievalResult result) {
        List<PhoneRecord> topPicks = result.recommendationIfPresent()
                .map(Recommendation::topPickRecords)
                .orElseGet(() -> result.records().stream().limit(CandidateRanker.SHORTLIST_SIZE).toList());
        if (topPicks.isEmpty()) {
            return NO_PHONES_FOUND;
        }

        StringBuilder sb = new StringBuilder(recommendationTitle(result.criteria())).append("\n\n");
        for (int i = 0; i < topPicks.size(); i++) {
            PhoneRecord phone = topPicks.get(i);
            sb.append(i + 1).append(". **").append(phone.modelName()).append("**\n")
                    .append("   ").append(BULLET).append("Price: ").append(valueOrNa(phone.price())).append('\n')
                    .append("   ").append(BULLET).append("Battery: ").append(valueOrNa(phone.battery())).append('\n')
                    .append("   ").append(BULLET).append("Camera: ").append(valueOrNa(phone.camera())).append('\n')
                    .append("   ").append(BULLET).append("Display: ").append(valueOrNa(phone.display())).append("\n\n");
        }
        sb.append("Top recommendation: ").append(topPicks.get(0).modelName())
                .append(" offers the best value for your needs.");
        return sb.toString();
    }

    String renderGeneral(RetrievalResult result) {
        int count = result.records().size();
        if (count == 1) {
            return renderSpecs(result.records().get(0));
        }
        if (count >= 2) {
            return renderRecommendation(result);
        }
        return ASK_FOR_MODEL;
    }

    private static String recommendationTitle(CriteriaSet criteria) {
        Focus focus = criteria.effectiveFocus();
        if (focus == Focus.BATTERY) {
            return "Best Samsung phones for battery life:";
        }
        if (focus == Focus.CAMERA) {
            return "Best Samsung phones for photography:";
        }
        if (criteria.hasPriceMax()) {
            return "Best Samsung phones under $" + criteria.priceMax().intValue() + ":";
        }
        return "Based on your requirements, here are my recommendations:";
    }

    /**
     * A question that mentions photos gets the camera verdict even when another aspect
     * won the focus.
     */
    private static String comparisonVerdict(PhoneRecord a, PhoneRecord b, Focus focus, String question) {
        if (focus == Focus.CAMERA || QueryTokenizer.containsKeyword(QueryTokenizer.tokenize(question), "photo")) {
            OptionalInt mpA = SpecParser.mainCameraMp(a.camera());
            OptionalInt mpB = SpecParser.mainCameraMp(b.camera());
            if (mpA.isPresent() && mpB.isPresent()) {
                return verdict(a, b, mpA.getAsInt(), mpB.getAsInt(), "MP",
                        "has a better camera", " and is recommended for photography.",
                        "Both phones have similar camera capabilities. Consider other factors like price and features.");
            }
        } else if (focus == Focus.BATTERY) {
            OptionalInt mahA = SpecParser.batteryMah(a.battery());
            OptionalInt mahB = SpecParser.batteryMah(b.battery());
            if (mahA.isPresent() && mahB.isPresent()) {
                return verdict(a, b, mahA.getAsInt(), mahB.getAsInt(), "mAh",
                        "has better battery life", ".",
                        "Both phones have similar battery capacity.");
            }
        }
        return a.modelName() + " is the newer model with improved overall performance and features.";
    }

    private static String verdict(PhoneRecord a, PhoneRecord b, int valueA, int valueB, String unit,
                                  String claim, String ending, String tie) {
        if (valueA == valueB) {
            return tie;
        }
        boolean firstWins = valueA > valueB;
        PhoneRecord winner = firstWins ? a : b;
        int high = Math.max(valueA, valueB);
        int low = Math.min(valueA, valueB);
        return winner.modelName() + " " + claim + " (" + high + unit + " vs " + low + unit + ")" + ending;
    }

    private static void appendSideBySide(StringBuilder sb, String heading, PhoneRecord a, PhoneRecord b,
                                         Function<PhoneRecord, String> field) {
        sb.append(heading).append(":\n")
                .append("  ").append(BULLET).append(a.modelName()).append(": ").append(valueOrNa(field.apply(a))).append('\n')
                .append("  ").append(BULLET).append(b.modelName()).append(": ").append(valueOrNa(field.apply(b))).append("\n\n");
    }

    private static String valueOrNa(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }
}
