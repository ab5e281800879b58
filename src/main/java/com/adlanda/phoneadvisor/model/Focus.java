package com.adlanda.phoneadvisor.model;

import java.util.Locale;

/**
 * The attribute a recommendation or comparison should weight most heavily.
 * {@link #OVERALL} is what callers use when a question names no focus.
 */
public enum Focus {
    BATTERY,
    CAMERA,
    DISPLAY,
    OVERALL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
