package com.adlanda.phoneadvisor.model;

import java.util.Locale;
import java.util.function.Function;

/**
 * Attributes compared between two phones, declared in canonical comparison order.
 */
public enum PhoneAttribute {
    DISPLAY(PhoneRecord::display),
    BATTERY(PhoneRecord::battery),
    CAMERA(PhoneRecord::camera),
    RAM(PhoneRecord::ram),
    STORAGE(PhoneRecord::storage),
    CHIPSET(PhoneRecord::chipset),
    PRICE(PhoneRecord::price);

    private final Function<PhoneRecord, String> accessor;

    PhoneAttribute(Function<PhoneRecord, String> accessor) {
        this.accessor = accessor;
    }

    public String valueOf(PhoneRecord record) {
        return accessor.apply(record);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
