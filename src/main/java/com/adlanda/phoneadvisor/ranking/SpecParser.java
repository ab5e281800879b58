package com.adlanda.phoneadvisor.ranking;

import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts magnitudes from free-form spec text. Every method is total: text that carries
 * no recognizable value (including null and "N/A") yields an empty result.
 */
public final class SpecParser {

    private static final Pattern MAH = Pattern.compile("(\\d+)\\s*mAh", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEGAPIXELS = Pattern.compile("(\\d+)\\s*MP", Pattern.CASE_INSENSITIVE);
    private static final Pattern GIGABYTES = Pattern.compile("(\\d+)\\s*GB", Pattern.CASE_INSENSITIVE);
    private static final Pattern USD = Pattern.compile("\\$\\s*(\\d[\\d,]*(?:\\.\\d+)?)");
    private static final Pattern EUR = Pattern.compile("€\\s*(\\d[\\d,]*(?:\\.\\d+)?)");
    private static final Pattern HIGH_REFRESH = Pattern.compile("\\b120\\s*hz", Pattern.CASE_INSENSITIVE);
    private static final Pattern AMOLED = Pattern.compile("amoled", Pattern.CASE_INSENSITIVE);

    private SpecParser() {
    }

    /** First capacity in mAh. */
    public static OptionalInt batteryMah(String battery) {
        return firstInt(MAH, battery);
    }

    /** Main (first listed) camera resolution in MP. */
    public static OptionalInt mainCameraMp(String camera) {
        return firstInt(MEGAPIXELS, camera);
    }

    /** First RAM size in GB; "12/16 GB" reads as 16, the option written next to the unit. */
    public static OptionalInt ramGb(String ram) {
        return firstInt(GIGABYTES, ram);
    }

    /**
     * Price in dollars when a USD amount is present, else the first EUR amount.
     */
    public static OptionalDouble price(String price) {
        if (price == null) {
            return OptionalDouble.empty();
        }
        OptionalDouble usd = firstAmount(USD, price);
        return usd.isPresent() ? usd : firstAmount(EUR, price);
    }

    public static boolean hasHighRefreshRate(String display) {
        return display != null && HIGH_REFRESH.matcher(display).find();
    }

    public static boolean hasAmoledPanel(String display) {
        return display != null && AMOLED.matcher(display).find();
    }

    private static OptionalInt firstInt(Pattern pattern, String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static OptionalDouble firstAmount(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(matcher.group(1).replace(",", "")));
    }
}
