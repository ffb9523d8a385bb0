package com.calculatorio.core.ports;

import com.calculatorio.core.infrastructure.ComponentDefinition;

import java.util.List;

/**
 * Supplies component definitions to a catalog.
 * Definitions must be ordered so that every ingredient appears before its first use.
 */
public interface ICatalogSource {

    List<ComponentDefinition> loadDefinitions();

    // Where the definitions come from, for log lines
    String describe();
}
