package com.calculatorio.core.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HumanizerTest {

    @ParameterizedTest
    @CsvSource({
        "2.01, 3",
        "2.00, 2",
        "2.0000000000000004, 2",
        "1.9999999999999998, 2",
        "0.1, 1",
        "0.0, 0",
        "11.5, 12",
        "2.0000000005, 3",
        "1000000.0000001, 1000001",
        "3000000000.0000005, 3000000000"
    })
    void roundUpIsCeiling(double value, long expected) {
        assertThat(Humanizer.roundUp(value)).isEqualTo(expected);
    }

    @Test
    void roundUpRejectsNaN() {
        assertThatThrownBy(() -> Humanizer.roundUp(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void roundUpRejectsValuesBeyondLongRange() {
        assertThatThrownBy(() -> Humanizer.roundUp(1e19))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("long range");
        assertThat(Humanizer.roundUp(1e18)).isEqualTo(1_000_000_000_000_000_000L);
    }

    @Test
    void humanizeKeepsOrder() {
        Map<String, Double> totals = new LinkedHashMap<>();
        totals.put("red_sci", 5.0);
        totals.put("gear", 0.5);

        assertThat(Humanizer.humanize(totals)).containsExactly(Map.entry("red_sci", 5L), Map.entry("gear", 1L));
    }

    @Test
    void printWritesOneLinePerEntry() {
        Map<String, Double> totals = new LinkedHashMap<>();
        totals.put("steel", 6.4);
        totals.put("iron", 2.0);

        assertThat(capture(out -> Humanizer.print(totals, out)))
                .isEqualTo("steel : 7" + System.lineSeparator() + "iron : 2" + System.lineSeparator());
    }

    @Test
    void printSortedOrdersByName() {
        Map<String, Double> totals = new LinkedHashMap<>();
        totals.put("steel", 1.0);
        totals.put("gear", 1.2);

        assertThat(capture(out -> Humanizer.printSorted(totals, out)))
                .isEqualTo("gear : 2" + System.lineSeparator() + "steel : 1" + System.lineSeparator());
    }

    private static String capture(Consumer<PrintStream> writer) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        writer.accept(out);
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
