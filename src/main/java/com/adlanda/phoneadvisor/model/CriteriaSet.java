package com.adlanda.phoneadvisor.model;

import java.util.Optional;

/**
 * Soft constraints extracted from a question. A field is null when the question
 * carries no signal for it; there are no defaults.
 *
 * @param priceMax Price ceiling in the catalog currency, or null
 * @param focus    Focus attribute, or null
 */
public record CriteriaSet(Double priceMax, Focus focus) {

    private static final CriteriaSet NONE = new CriteriaSet(null, null);

    public static CriteriaSet none() {
        return NONE;
    }

    public boolean hasPriceMax() {
        return priceMax != null;
    }

    public Optional<Focus> focusIfSet() {
        return Optional.ofNullable(focus);
    }

    /**
     * Focus to apply when ranking or rendering: the extracted one, else {@link Focus#OVERALL}.
     */
    public Focus effectiveFocus() {
        return focus != null ? focus : Focus.OVERALL;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        if (priceMax != null) {
            sb.append("priceMax=").append(priceMax.intValue());
        }
        if (focus != null) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append("focus=").append(focus.label());
        }
        return sb.append('}').toString();
    }
}
