package com.calculatorio.core.infrastructure;

import com.calculatorio.core.domain.catalog.Component;
import com.calculatorio.core.domain.catalog.ProducerCategory;
import com.calculatorio.core.domain.errors.CatalogFormatException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a catalog file, as written by hand.
 *
 * Recipes that output several units per craft declare {@code batch}: seconds and
 * ingredient quantities are given per craft and divided by batch on conversion,
 * e.g. sulfur = 1s, batch 2, {water: 30, gas: 30} -> 0.5s, {water: 15, gas: 15} per unit.
 */
public record ComponentDefinition(
        String name,
        Double seconds,            // null = raw resource
        Double batch,              // units per craft, default 1
        String producer,           // machine | chem_plant | furnace | rocket_silo | infinite
        Map<String, Double> ingredients
) {

    public Component toComponent() {
        if (name == null || name.isBlank()) {
            throw new CatalogFormatException("Catalog entry without a name");
        }

        double units = (batch != null ? batch : 1.0);
        if (Double.isNaN(units) || Double.isInfinite(units) || units <= 0) {
            throw new CatalogFormatException("Invalid batch for " + name + ": " + batch);
        }

        ProducerCategory category;
        try {
            category = (producer != null) ? ProducerCategory.fromId(producer) : ProducerCategory.INFINITE;
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException("Invalid producer for " + name + ": " + producer, e);
        }

        Map<String, Double> perUnit = new LinkedHashMap<>();
        if (ingredients != null) {
            for (var e : ingredients.entrySet()) {
                if (e.getValue() == null) {
                    throw new CatalogFormatException("Missing quantity of " + e.getKey() + " in " + name);
                }
                perUnit.put(e.getKey(), e.getValue() / units);
            }
        }

        Double perUnitSeconds = (seconds != null ? seconds / units : null);
        try {
            return new Component(name, perUnitSeconds, perUnit, category);
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException("Invalid catalog entry '" + name + "': " + e.getMessage(), e);
        }
    }
}
