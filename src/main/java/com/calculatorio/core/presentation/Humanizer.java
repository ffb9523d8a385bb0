package com.calculatorio.core.presentation;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders fractional totals for humans.
 *
 * Producers and items only come in whole units, so every value is rounded UP:
 * 2.01 machines means 3 machines. A value a few ulps away from an integer is float
 * noise from the multiplications upstream and is snapped to it (2.0000000000000004 -> 2).
 */
public final class Humanizer {

    static final int NOISE_ULPS = 8;

    private static final double LONG_RANGE = 0x1p63;

    private Humanizer() {}

    public static long roundUp(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot round " + value);
        }
        double nearest = Math.rint(value);
        double rounded = (Math.abs(value - nearest) <= Math.ulp(value) * NOISE_ULPS) ? nearest : Math.ceil(value);
        if (rounded >= LONG_RANGE || rounded < -LONG_RANGE) {
            throw new IllegalArgumentException("Cannot round " + value + ": out of long range");
        }
        return (long) rounded;
    }

    public static Map<String, Long> humanize(Map<String, Double> totals) {
        Map<String, Long> out = new LinkedHashMap<>();
        if (totals == null) return out;
        for (var e : totals.entrySet()) {
            out.put(e.getKey(), roundUp(e.getValue()));
        }
        return out;
    }

    public static String formatLine(String name, double total) {
        return name + " : " + roundUp(total);
    }

    /** One "name : N" line per entry, in the map's iteration order. */
    public static void print(Map<String, Double> totals, PrintStream out) {
        if (totals == null) return;
        for (var e : totals.entrySet()) {
            out.println(formatLine(e.getKey(), e.getValue()));
        }
    }

    public static void printSorted(Map<String, Double> totals, PrintStream out) {
        if (totals == null) return;
        print(new TreeMap<>(totals), out);
    }
}
