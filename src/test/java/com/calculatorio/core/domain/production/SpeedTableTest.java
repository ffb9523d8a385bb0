package com.calculatorio.core.domain.production;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.calculatorio.core.domain.catalog.ProducerCategory;
import com.calculatorio.core.domain.errors.InvalidRateException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class SpeedTableTest {

    @ParameterizedTest
    @EnumSource(ProducerCategory.class)
    void missingCategoryDefaultsToOne(ProducerCategory category) {
        assertThat(SpeedTable.none().multiplierFor(category)).isEqualTo(1.0);
    }

    @Test
    void ofCopiesMultipliers() {
        Map<ProducerCategory, Double> source = new HashMap<>();
        source.put(ProducerCategory.MACHINE, 0.75);

        SpeedTable table = SpeedTable.of(source);
        source.put(ProducerCategory.MACHINE, 5.0);

        assertThat(table.multiplierFor(ProducerCategory.MACHINE)).isEqualTo(0.75);
        assertThat(table.multiplierFor(ProducerCategory.FURNACE)).isEqualTo(1.0);
    }

    @Test
    void withLeavesOriginalUntouched() {
        SpeedTable base = SpeedTable.of(Map.of(ProducerCategory.FURNACE, 2.0));

        SpeedTable faster = base.with(ProducerCategory.MACHINE, 1.25);

        assertThat(base.asMap()).containsOnlyKeys(ProducerCategory.FURNACE);
        assertThat(faster.asMap())
                .containsEntry(ProducerCategory.FURNACE, 2.0)
                .containsEntry(ProducerCategory.MACHINE, 1.25);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.5, Double.NaN, Double.POSITIVE_INFINITY})
    void nonPositiveMultiplierIsRejected(double multiplier) {
        assertThatThrownBy(() -> SpeedTable.none().with(ProducerCategory.CHEM_PLANT, multiplier))
                .isInstanceOf(InvalidRateException.class)
                .hasMessageContaining("chem_plant");
        assertThatThrownBy(() -> SpeedTable.of(Map.of(ProducerCategory.CHEM_PLANT, multiplier)))
                .isInstanceOf(InvalidRateException.class);
    }

    @Test
    void nullMultiplierIsRejected() {
        Map<ProducerCategory, Double> source = new HashMap<>();
        source.put(ProducerCategory.MACHINE, null);

        assertThatThrownBy(() -> SpeedTable.of(source)).isInstanceOf(InvalidRateException.class);
    }
}
