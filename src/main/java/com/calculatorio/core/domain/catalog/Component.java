package com.calculatorio.core.domain.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named item of the production graph.
 *
 * craftSeconds is the time to produce ONE unit; null (or 0) means raw resource.
 * ingredients are the quantities consumed per ONE unit produced.
 * Only craftSeconds decides whether a component is raw. A crafted component must name a
 * real producer: INFINITE is reserved for raw resources.
 */
public record Component(
        String name,
        Double craftSeconds,
        Map<String, Double> ingredients,
        ProducerCategory producerCategory
) {

    public Component {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name is blank");
        }
        if (craftSeconds != null && (craftSeconds.isNaN() || craftSeconds.isInfinite() || craftSeconds < 0)) {
            throw new IllegalArgumentException("Invalid craft time for " + name + ": " + craftSeconds);
        }
        Objects.requireNonNull(producerCategory, "producerCategory");
        if (producerCategory == ProducerCategory.INFINITE && craftSeconds != null && craftSeconds > 0) {
            throw new IllegalArgumentException("Crafted component " + name + " cannot use producer " + producerCategory.getId());
        }

        Map<String, Double> copy = new LinkedHashMap<>();
        if (ingredients != null) {
            for (var e : ingredients.entrySet()) {
                Double qty = e.getValue();
                if (e.getKey() == null || e.getKey().isBlank()) {
                    throw new IllegalArgumentException("Blank ingredient name in " + name);
                }
                if (qty == null || qty.isNaN() || qty.isInfinite() || qty < 0) {
                    throw new IllegalArgumentException("Invalid quantity of " + e.getKey() + " in " + name + ": " + qty);
                }
                copy.put(e.getKey(), qty);
            }
        }
        ingredients = Collections.unmodifiableMap(copy);
    }

    public static Component raw(String name) {
        return new Component(name, null, Map.of(), ProducerCategory.INFINITE);
    }

    public static Component crafted(String name, double craftSeconds, Map<String, Double> ingredients, ProducerCategory category) {
        return new Component(name, craftSeconds, ingredients, category);
    }

    public boolean isRaw() {
        return craftSeconds == null || craftSeconds == 0.0;
    }

    /**
     * Units produced per second by a single producer with no speed bonus.
     */
    public double unitsPerSecond() {
        if (isRaw()) {
            throw new IllegalStateException("Raw component has no production rate: " + name);
        }
        return 1.0 / craftSeconds;
    }
}
