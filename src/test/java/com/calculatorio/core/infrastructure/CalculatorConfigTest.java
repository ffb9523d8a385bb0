package com.calculatorio.core.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.calculatorio.core.domain.catalog.ProducerCategory;
import com.calculatorio.core.domain.errors.InvalidRateException;
import com.calculatorio.core.domain.production.ResolutionEngine;
import com.calculatorio.core.domain.production.SpeedTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CalculatorConfigTest {

    @Test
    void defaultsWhenKeysAreMissing() {
        CalculatorConfig config = CalculatorConfig.defaults();

        assertThat(config.maxDepth()).isEqualTo(ResolutionEngine.DEFAULT_MAX_DEPTH);
        assertThat(config.catalogResource()).isEqualTo(CatalogLoader.DEFAULT_RESOURCE);
        assertThat(config.speedTable().asMap()).isEmpty();
    }

    @Test
    void readsTypedValues() {
        CalculatorConfig config = CalculatorConfig.fromString(
                "engine.max_depth=12\n"
                        + "speed.machine=0.75\n"
                        + "speed.furnace = 2\n");

        assertThat(config.maxDepth()).isEqualTo(12);

        SpeedTable speeds = config.speedTable();
        assertThat(speeds.multiplierFor(ProducerCategory.MACHINE)).isEqualTo(0.75);
        assertThat(speeds.multiplierFor(ProducerCategory.FURNACE)).isEqualTo(2.0);
        assertThat(speeds.multiplierFor(ProducerCategory.CHEM_PLANT)).isEqualTo(1.0);
    }

    @Test
    void malformedNumberFallsBackToDefault() {
        CalculatorConfig config = CalculatorConfig.fromString("engine.max_depth=deep\nspeed.machine=fast");

        assertThat(config.getInt("engine.max_depth", 7)).isEqualTo(7);
        assertThat(config.speedTable().multiplierFor(ProducerCategory.MACHINE)).isEqualTo(1.0);
    }

    @Test
    void nonPositiveSpeedIsRejected() {
        CalculatorConfig config = CalculatorConfig.fromString("speed.chem_plant=0");

        assertThatThrownBy(config::speedTable).isInstanceOf(InvalidRateException.class);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(CalculatorConfig.FILE_NAME);
        Files.writeString(file, "catalog.resource=catalog/test-mini.json\n");

        assertThat(CalculatorConfig.load(file).catalogResource()).isEqualTo("catalog/test-mini.json");
    }

    @Test
    void unreadableFileUsesDefaults(@TempDir Path dir) {
        CalculatorConfig config = CalculatorConfig.load(dir.resolve("missing.properties"));

        assertThat(config.maxDepth()).isEqualTo(ResolutionEngine.DEFAULT_MAX_DEPTH);
    }

    @Test
    void classpathCopyIsFound() {
        // src/main/resources/calculatorio.properties ships the defaults
        assertThat(CalculatorConfig.load().maxDepth()).isEqualTo(ResolutionEngine.DEFAULT_MAX_DEPTH);
    }
}
