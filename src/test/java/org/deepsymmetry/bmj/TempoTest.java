package org.deepsymmetry.bmj;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TempoTest {

    @Test
    void clampedAlwaysLandsWithinBounds() {
        long[] inputs = {Long.MIN_VALUE, -500, 0, 1, 2, 100, 399, 400, 401, 10_000, Long.MAX_VALUE};
        for (long input : inputs) {
            Tempo tempo = Tempo.clamped(input);
            assertThat(tempo.value).isBetween(Tempo.MIN, Tempo.MAX);
        }
    }

    @Test
    void clampedPullsOutOfRangeValuesToNearestBound() {
        assertThat(Tempo.clamped(0).value).isEqualTo(Tempo.MIN);
        assertThat(Tempo.clamped(-20).value).isEqualTo(Tempo.MIN);
        assertThat(Tempo.clamped(Tempo.MAX + 1).value).isEqualTo(Tempo.MAX);
        assertThat(Tempo.clamped(120).value).isEqualTo(120);
    }

    @Test
    void constructorRejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new Tempo(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Tempo(Tempo.MAX + 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void incrementStopsAtMax() {
        Tempo max = new Tempo(Tempo.MAX);
        assertThat(max.increment()).isSameAs(max);
        assertThat(new Tempo(99).increment().value).isEqualTo(100);
    }

    @Test
    void decrementStopsAtMin() {
        Tempo min = new Tempo(Tempo.MIN);
        assertThat(min.decrement()).isSameAs(min);
        assertThat(new Tempo(100).decrement().value).isEqualTo(99);
    }

    @Test
    void beatIntervalTruncates() {
        assertThat(new Tempo(120).beatIntervalMillis()).isEqualTo(500L);
        assertThat(new Tempo(100).beatIntervalMillis()).isEqualTo(600L);
        // 60000 / 350 = 171.43
        assertThat(new Tempo(350).beatIntervalMillis()).isEqualTo(171L);
        assertThat(new Tempo(Tempo.MIN).beatIntervalMillis()).isEqualTo(60_000L);
    }

    @Test
    void equalityIsByValue() {
        assertThat(new Tempo(90)).isEqualTo(new Tempo(90)).hasSameHashCodeAs(new Tempo(90));
        assertThat(new Tempo(90)).isNotEqualTo(new Tempo(91));
    }
}
