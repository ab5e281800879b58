package com.adlanda.phoneadvisor.ranking;

import com.adlanda.phoneadvisor.model.CriteriaSet;
import com.adlanda.phoneadvisor.model.Focus;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Scores a record for a recommendation question.
 *
 * The score is the sum of independent terms, each contributing only when its attribute
 * parses:
 * <pre>
 *   battery mAh / 1000 + main camera MP / 50 + RAM GB / 4
 *   + focus bonus   (battery: mAh / 500, camera: MP / 25, display: 2 for 120 Hz + 1 for AMOLED)
 *   + budget term   (+3 within priceMax, -5 above it)
 * </pre>
 */
@Component
public class CandidateScorer {

    static final double WITHIN_BUDGET_BONUS = 3;
    static final double OVER_BUDGET_PENALTY = 5;

    public double score(PhoneRecord record, Focus focus, CriteriaSet criteria) {
        OptionalInt battery = SpecParser.batteryMah(record.battery());
        OptionalInt camera = SpecParser.mainCameraMp(record.camera());
        OptionalInt ram = SpecParser.ramGb(record.ram());

        double score = 0;
        if (battery.isPresent()) {
            score += battery.getAsInt() / 1000.0;
        }
        if (camera.isPresent()) {
            score += camera.getAsInt() / 50.0;
        }
        if (ram.isPresent()) {
            score += ram.getAsInt() / 4.0;
        }

        score += focusBonus(record, focus, battery, camera);

        if (criteria != null && criteria.hasPriceMax()) {
            OptionalDouble price = SpecParser.price(record.price());
            if (price.isPresent()) {
                score += price.getAsDouble() <= criteria.priceMax() ? WITHIN_BUDGET_BONUS : -OVER_BUDGET_PENALTY;
            }
        }
        return score;
    }

    private double focusBonus(PhoneRecord record, Focus focus, OptionalInt battery, OptionalInt camera) {
        if (focus == null) {
            return 0;
        }
        switch (focus) {
            case BATTERY:
                return battery.isPresent() ? battery.getAsInt() / 500.0 : 0;
            case CAMERA:
                return camera.isPresent() ? camera.getAsInt() / 25.0 : 0;
            case DISPLAY:
                double bonus = 0;
                if (SpecParser.hasHighRefreshRate(record.display())) {
                    bonus += 2;
                }
                if (SpecParser.hasAmoledPanel(record.display())) {
                    bonus += 1;
                }
                return bonus;
            default:
                return 0;
        }
    }
}
