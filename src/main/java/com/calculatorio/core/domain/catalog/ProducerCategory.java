package com.calculatorio.core.domain.catalog;

import java.util.Locale;

/**
 * Class of building (or process) that produces a component.
 * INFINITE marks raw resources: always available, never needs a producer.
 */
public enum ProducerCategory {
    MACHINE("machine"),
    CHEM_PLANT("chem_plant"),
    FURNACE("furnace"),
    ROCKET_SILO("rocket_silo"),
    INFINITE("infinite");

    private final String id;

    ProducerCategory(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static ProducerCategory fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Producer category id is blank");
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        for (ProducerCategory c : values()) {
            if (c.id.equals(key)) return c;
        }
        throw new IllegalArgumentException("Unknown producer category: " + id);
    }
}
