package com.calculatorio.core.domain.catalog;

import com.calculatorio.core.domain.errors.DuplicateComponentException;
import com.calculatorio.core.domain.errors.UnknownComponentException;
import com.calculatorio.core.domain.errors.UnknownIngredientException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of component definitions, keyed by name.
 *
 * An ingredient must be registered before any component that uses it, so the
 * graph is acyclic by construction. Registration and queries are separate
 * phases: once {@link #seal()} is called the catalog is read-only and may be
 * shared between threads.
 */
public class Catalog {

    private final Map<String, Component> components = new LinkedHashMap<>();
    private volatile boolean sealed = false;

    public synchronized void register(Component component) {
        if (sealed) {
            throw new IllegalStateException("Catalog is sealed, cannot register " + component.name());
        }
        if (components.containsKey(component.name())) {
            throw new DuplicateComponentException(component.name());
        }
        for (String ingredient : component.ingredients().keySet()) {
            if (!components.containsKey(ingredient)) {
                throw new UnknownIngredientException(component.name(), ingredient);
            }
        }
        components.put(component.name(), component);
    }

    public Component get(String name) {
        Component c = (name != null ? components.get(name) : null);
        if (c == null) throw new UnknownComponentException(name);
        return c;
    }

    public Optional<Component> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(components.get(name));
    }

    public boolean contains(String name) {
        return name != null && components.containsKey(name);
    }

    /** Names in registration order. */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(components.keySet()));
    }

    public int size() {
        return components.size();
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }
}
