package com.calculatorio.core.infrastructure;

import com.calculatorio.core.domain.catalog.ProducerCategory;
import com.calculatorio.core.domain.errors.InvalidRateException;
import com.calculatorio.core.domain.production.ResolutionEngine;
import com.calculatorio.core.domain.production.SpeedTable;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * External configuration.
 * Reads 'calculatorio.properties' from the working directory, then from the classpath.
 * Missing keys (or a missing file) fall back to defaults.
 *
 * Keys:
 *   engine.max_depth   = 64
 *   catalog.resource   = catalog/factorio.json
 *   speed.machine      = 0.75   (one key per producer category id, default 1.0)
 */
public class CalculatorConfig {

    public static final String FILE_NAME = "calculatorio.properties";

    private final Properties props;

    private CalculatorConfig(Properties props) {
        this.props = props;
    }

    public static CalculatorConfig load() {
        Path local = Path.of(FILE_NAME);
        if (Files.isRegularFile(local)) {
            return load(local);
        }

        Properties props = new Properties();
        try (InputStream in = CalculatorConfig.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                props.load(in);
                System.out.println("⚙️ Configuration loaded from classpath:" + FILE_NAME);
            } else {
                System.out.println("⚠️ " + FILE_NAME + " not found. Using DEFAULT values.");
            }
        } catch (IOException e) {
            System.err.println("⚠️ Cannot read classpath:" + FILE_NAME + " (" + e.getMessage() + "). Using DEFAULT values.");
            props.clear();
        }
        return new CalculatorConfig(props);
    }

    public static CalculatorConfig load(Path path) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
            System.out.println("⚙️ Configuration loaded from " + path);
        } catch (IOException e) {
            System.out.println("⚠️ " + path + " not readable. Using DEFAULT values.");
            props.clear();
        }
        return new CalculatorConfig(props);
    }

    public static CalculatorConfig fromString(String content) {
        Properties props = new Properties();
        try {
            props.load(new StringReader(content));
        } catch (IOException e) {
            // not thrown by StringReader
            throw new IllegalStateException(e);
        }
        return new CalculatorConfig(props);
    }

    public static CalculatorConfig defaults() {
        return new CalculatorConfig(new Properties());
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ Config error for " + key + ": " + val + " is not a number.");
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ Config error for " + key + ": " + val + " is not a number.");
            return defaultValue;
        }
    }

    public String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        return (val == null || val.isBlank()) ? defaultValue : val.trim();
    }

    public int maxDepth() {
        return getInt("engine.max_depth", ResolutionEngine.DEFAULT_MAX_DEPTH);
    }

    public String catalogResource() {
        return getString("catalog.resource", CatalogLoader.DEFAULT_RESOURCE);
    }

    /**
     * Speed table from the speed.* keys. An invalid multiplier (<= 0) is an input error,
     * not a typo to skip: it raises {@link InvalidRateException}.
     */
    public SpeedTable speedTable() {
        Map<ProducerCategory, Double> multipliers = new EnumMap<>(ProducerCategory.class);
        for (ProducerCategory c : ProducerCategory.values()) {
            String key = "speed." + c.getId();
            if (props.getProperty(key) != null) {
                multipliers.put(c, getDouble(key, 1.0));
            }
        }
        return SpeedTable.of(multipliers);
    }
}
