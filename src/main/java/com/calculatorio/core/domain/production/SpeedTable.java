package com.calculatorio.core.domain.production;

import com.calculatorio.core.domain.catalog.ProducerCategory;
import com.calculatorio.core.domain.errors.InvalidRateException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Throughput multipliers per producer category (e.g. 0.75 for assembling machine 2,
 * 1.25 for a machine with speed modules). Categories not in the table run at 1.0.
 */
public final class SpeedTable {

    private static final SpeedTable NONE = new SpeedTable(new EnumMap<>(ProducerCategory.class));

    private final Map<ProducerCategory, Double> multipliers;

    private SpeedTable(EnumMap<ProducerCategory, Double> multipliers) {
        this.multipliers = Collections.unmodifiableMap(multipliers);
    }

    public static SpeedTable none() {
        return NONE;
    }

    public static SpeedTable of(Map<ProducerCategory, Double> multipliers) {
        EnumMap<ProducerCategory, Double> copy = new EnumMap<>(ProducerCategory.class);
        if (multipliers != null) {
            for (var e : multipliers.entrySet()) {
                copy.put(e.getKey(), validate(e.getKey(), e.getValue()));
            }
        }
        return new SpeedTable(copy);
    }

    /** Copy of this table with one category overridden. */
    public SpeedTable with(ProducerCategory category, double multiplier) {
        EnumMap<ProducerCategory, Double> copy = new EnumMap<>(ProducerCategory.class);
        copy.putAll(multipliers);
        copy.put(category, validate(category, multiplier));
        return new SpeedTable(copy);
    }

    public double multiplierFor(ProducerCategory category) {
        return multipliers.getOrDefault(category, 1.0);
    }

    public Map<ProducerCategory, Double> asMap() {
        return multipliers;
    }

    private static double validate(ProducerCategory category, Double multiplier) {
        if (category == null) {
            throw new InvalidRateException("Speed table contains a null producer category");
        }
        if (multiplier == null || multiplier.isNaN() || multiplier.isInfinite() || multiplier <= 0) {
            throw new InvalidRateException("Speed multiplier for " + category.getId() + " must be > 0, got " + multiplier);
        }
        return multiplier;
    }

    @Override
    public String toString() {
        return "SpeedTable" + multipliers;
    }
}
