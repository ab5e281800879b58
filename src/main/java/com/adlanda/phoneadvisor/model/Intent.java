package com.adlanda.phoneadvisor.model;

import java.util.Locale;

/**
 * Coarse purpose of a question.
 */
public enum Intent {
    COMPARISON,
    RECOMMENDATION,
    SPECS,
    GENERAL;

    /**
     * Lower-case label used in prompts and logs.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
