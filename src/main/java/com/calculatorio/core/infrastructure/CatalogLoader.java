package com.calculatorio.core.infrastructure;

import com.calculatorio.core.domain.catalog.Catalog;
import com.calculatorio.core.domain.catalog.Component;
import com.calculatorio.core.ports.ICatalogSource;

import java.util.List;

/**
 * Fills a {@link Catalog} from an {@link ICatalogSource}, in source order.
 */
public final class CatalogLoader {

    public static final String DEFAULT_RESOURCE = "catalog/factorio.json";

    private CatalogLoader() {}

    public static Catalog loadDefault() {
        return loadSealed(JsonCatalogSource.classpath(DEFAULT_RESOURCE));
    }

    /** Catalog resource named by {@code catalog.resource}, sealed after loading. */
    public static Catalog load(CalculatorConfig config) {
        return loadSealed(JsonCatalogSource.classpath(config.catalogResource()));
    }

    public static Catalog loadSealed(ICatalogSource source) {
        Catalog catalog = new Catalog();
        populate(catalog, source);
        catalog.seal();
        return catalog;
    }

    /**
     * Registers every definition of {@code source}. Registration errors are propagated
     * as-is; components registered before the failing one stay in the catalog.
     */
    public static int populate(Catalog catalog, ICatalogSource source) {
        System.out.println("[CatalogLoader] Loading components from " + source.describe() + "...");
        List<ComponentDefinition> definitions = source.loadDefinitions();

        int raw = 0;
        for (ComponentDefinition def : definitions) {
            Component c = def.toComponent();
            catalog.register(c);
            if (c.isRaw()) raw++;
        }

        System.out.println("[CatalogLoader] Registered " + definitions.size() + " components ("
                + raw + " raw, " + (definitions.size() - raw) + " crafted)");
        return definitions.size();
    }
}
