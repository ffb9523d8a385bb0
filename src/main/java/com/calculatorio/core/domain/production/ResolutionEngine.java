package com.calculatorio.core.domain.production;

import com.calculatorio.core.domain.catalog.Catalog;
import com.calculatorio.core.domain.catalog.Component;
import com.calculatorio.core.domain.catalog.ProducerCategory;
import com.calculatorio.core.domain.errors.InvalidRateException;
import com.calculatorio.core.domain.errors.ResolutionDepthExceededException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Walks the ingredient graph of a {@link Catalog}.
 *
 * - summarize: total quantity of every component needed for one unit
 * - producersNeeded: producers required to sustain a target rate
 * - combinedProducersNeeded: same, summed over a bill of materials
 *
 * Results are fractional; rounding is left to the presentation layer.
 */
public class ResolutionEngine {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final Catalog catalog;
    private final int maxDepth;

    // A registered component never changes and its ingredients are registered before it,
    // so a summary stays valid for the lifetime of the catalog.
    private final Map<String, Summary> summaryCache = new ConcurrentHashMap<>();

    public ResolutionEngine(Catalog catalog) {
        this(catalog, DEFAULT_MAX_DEPTH);
    }

    public ResolutionEngine(Catalog catalog, int maxDepth) {
        if (catalog == null) throw new IllegalArgumentException("catalog is null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        this.catalog = catalog;
        this.maxDepth = maxDepth;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Total quantity of each component (itself included, with quantity 1) needed to build
     * one unit of {@code componentName} from raw resources.
     */
    public Map<String, Double> summarize(String componentName) {
        Component root = catalog.get(componentName);
        Summary cached = summaryCache.get(root.name());
        if (cached != null) return cached.totals();

        // Explicit stack: every frame is one level of the current dependency path.
        Deque<Frame> path = new ArrayDeque<>();
        path.push(new Frame(root, 1.0));

        while (true) {
            Frame frame = path.peek();

            if (frame.pending.hasNext()) {
                Map.Entry<String, Double> ingredient = frame.pending.next();
                Summary sub = summaryCache.get(ingredient.getKey());
                if (sub != null) {
                    // a cached chain still counts for its full height below this frame
                    if (path.size() + sub.height() > maxDepth) {
                        throw new ResolutionDepthExceededException(root.name(), maxDepth);
                    }
                    frame.accumulate(sub, ingredient.getValue());
                } else {
                    if (path.size() >= maxDepth) {
                        throw new ResolutionDepthExceededException(root.name(), maxDepth);
                    }
                    path.push(new Frame(catalog.get(ingredient.getKey()), ingredient.getValue()));
                }
                continue;
            }

            path.pop();
            Summary done = new Summary(Collections.unmodifiableMap(frame.totals), frame.height);
            summaryCache.putIfAbsent(frame.component.name(), done);

            Frame parent = path.peek();
            if (parent == null) return done.totals();
            parent.accumulate(done, frame.quantityInParent);
        }
    }

    /**
     * Producers needed for each crafted component in the chain to output
     * {@code targetUnits} of {@code componentName} every {@code overSeconds} seconds.
     * Raw components never appear in the result.
     */
    public Map<String, Double> producersNeeded(String componentName, double targetUnits, double overSeconds, SpeedTable speeds) {
        validateRate(targetUnits, overSeconds);
        SpeedTable table = (speeds != null ? speeds : SpeedTable.none());

        double targetRate = targetUnits / overSeconds;
        Map<String, Double> producers = new LinkedHashMap<>();

        for (var e : summarize(componentName).entrySet()) {
            Component c = catalog.get(e.getKey());
            if (c.isRaw()) continue;

            double effectiveRate = c.unitsPerSecond() * table.multiplierFor(c.producerCategory());
            double requiredPerSecond = e.getValue() * targetRate;
            producers.put(c.name(), requiredPerSecond / effectiveRate);
        }
        return producers;
    }

    /**
     * Sum of {@link #producersNeeded} over every entry of {@code targets} (component name -> units).
     */
    public Map<String, Double> combinedProducersNeeded(Map<String, Double> targets, double overSeconds, SpeedTable speeds) {
        Map<String, Double> combined = new LinkedHashMap<>();
        if (targets == null || targets.isEmpty()) {
            validateRate(0.0, overSeconds);
            return combined;
        }

        // Fail on unknown names before doing any work.
        for (String name : targets.keySet()) {
            catalog.get(name);
        }

        for (var target : targets.entrySet()) {
            Double units = target.getValue();
            if (units == null) {
                throw new InvalidRateException("Missing unit count for " + target.getKey());
            }
            Map<String, Double> single = producersNeeded(target.getKey(), units, overSeconds, speeds);
            for (var e : single.entrySet()) {
                combined.merge(e.getKey(), e.getValue(), Double::sum);
            }
        }
        return combined;
    }

    /**
     * Folds a producer map (component name -> producers) into totals per producer category.
     */
    public Map<ProducerCategory, Double> producersByCategory(Map<String, Double> producers) {
        Map<ProducerCategory, Double> byCategory = new EnumMap<>(ProducerCategory.class);
        if (producers == null) return byCategory;

        for (var e : producers.entrySet()) {
            ProducerCategory category = catalog.get(e.getKey()).producerCategory();
            byCategory.merge(category, e.getValue(), Double::sum);
        }
        return byCategory;
    }

    private static void validateRate(double targetUnits, double overSeconds) {
        if (Double.isNaN(overSeconds) || Double.isInfinite(overSeconds) || overSeconds <= 0) {
            throw new InvalidRateException("Time window must be > 0 seconds, got " + overSeconds);
        }
        if (Double.isNaN(targetUnits) || Double.isInfinite(targetUnits) || targetUnits < 0) {
            throw new InvalidRateException("Target units must be >= 0, got " + targetUnits);
        }
    }

    /** Totals for one unit, and the length of the longest chain below (a raw component has height 1). */
    private record Summary(Map<String, Double> totals, int height) {}

    private static final class Frame {
        final Component component;
        final double quantityInParent;
        final Iterator<Map.Entry<String, Double>> pending;
        final Map<String, Double> totals = new LinkedHashMap<>();
        int height = 1;

        Frame(Component component, double quantityInParent) {
            this.component = component;
            this.quantityInParent = quantityInParent;
            this.pending = component.ingredients().entrySet().iterator();
            totals.put(component.name(), 1.0);
        }

        void accumulate(Summary sub, double quantity) {
            height = Math.max(height, sub.height() + 1);
            for (var e : sub.totals().entrySet()) {
                totals.merge(e.getKey(), e.getValue() * quantity, Double::sum);
            }
        }
    }
}
