package com.calculatorio.core.infrastructure;

import com.calculatorio.core.domain.errors.CatalogFormatException;
import com.calculatorio.core.ports.ICatalogSource;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads component definitions from a JSON document:
 * <pre>
 * { "components": [ { "name": "gear", "seconds": 0.5, "producer": "machine", "ingredients": { "iron": 2 } } ] }
 * </pre>
 */
public class JsonCatalogSource implements ICatalogSource {

    private final String origin;
    private final ReaderSupplier supplier;
    private final Gson gson = new Gson();

    private JsonCatalogSource(String origin, ReaderSupplier supplier) {
        this.origin = origin;
        this.supplier = supplier;
    }

    public static JsonCatalogSource classpath(String resource) {
        return new JsonCatalogSource("classpath:" + resource, () -> {
            InputStream in = JsonCatalogSource.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) throw new CatalogFormatException("Catalog resource not found: " + resource);
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        });
    }

    public static JsonCatalogSource file(Path path) {
        return new JsonCatalogSource(path.toString(), () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static JsonCatalogSource fromString(String json) {
        return new JsonCatalogSource("inline", () -> new StringReader(json));
    }

    @Override
    public List<ComponentDefinition> loadDefinitions() {
        CatalogFile file;
        try (Reader reader = supplier.open()) {
            file = gson.fromJson(reader, CatalogFile.class);
        } catch (IOException e) {
            throw new CatalogFormatException("Cannot read catalog " + origin, e);
        } catch (JsonParseException e) {
            throw new CatalogFormatException("Malformed catalog " + origin + ": " + e.getMessage(), e);
        }

        if (file == null || file.components() == null) {
            throw new CatalogFormatException("Catalog " + origin + " has no 'components' array");
        }
        return new ArrayList<>(file.components());
    }

    @Override
    public String describe() {
        return origin;
    }

    record CatalogFile(List<ComponentDefinition> components) {}

    @FunctionalInterface
    private interface ReaderSupplier {
        Reader open() throws IOException;
    }
}
