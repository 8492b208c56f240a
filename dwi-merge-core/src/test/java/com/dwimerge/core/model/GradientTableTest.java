package com.dwimerge.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GradientTable}.
 */
class GradientTableTest {

    private final GradientTable table = new GradientTable(List.of(
        new GradientTable.Row(Vector3.ZERO, 5.0),
        new GradientTable.Row(new Vector3(1, 0, 0), 990.0),
        new GradientTable.Row(new Vector3(0, 1, 0), 2010.0)));

    @Test
    void shells_roundsToShellWidth() {
        assertThat(table.shells(100.0)).containsExactly(0.0, 1000.0, 2000.0);
    }

    @Test
    void toMrtrixFormat_writesOneLinePerVolume() {
        String text = table.toMrtrixFormat();

        assertThat(text.lines()).containsExactly(
            "0.00000000 0.00000000 0.00000000 5.0000",
            "1.00000000 0.00000000 0.00000000 990.0000",
            "0.00000000 1.00000000 0.00000000 2010.0000");
    }

    @Test
    void maxBValue_returnsLargest() {
        assertThat(table.maxBValue()).isEqualTo(2010.0);
    }
}
