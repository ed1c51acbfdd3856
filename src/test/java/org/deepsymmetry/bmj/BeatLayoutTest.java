package org.deepsymmetry.bmj;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BeatLayoutTest {

    @Test
    void defaultLayoutHasFourBeatsWithEmphasisAndSound() {
        BeatLayout layout = BeatLayout.DEFAULT;

        assertThat(layout.beats).isEqualTo(4);
        assertThat(layout.subdivisions).isEqualTo(1);
        assertThat(layout.gaps).isEmpty();
        assertThat(layout.emphasizeFirstBeat).isTrue();
        assertThat(layout.sound).isTrue();
    }

    @Test
    void rejectsBeatsOutsideSupportedRange() {
        assertThatThrownBy(() -> BeatLayout.DEFAULT.withBeats(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BeatLayout.DEFAULT.withBeats(9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BeatLayout.DEFAULT.withSubdivisions(5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BeatLayout.DEFAULT.withGaps(new HashSet<>(Arrays.asList(1, 9))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withersReplaceOneFieldAndLeaveOriginalUntouched() {
        BeatLayout changed = BeatLayout.DEFAULT.withBeats(7).withSound(false);

        assertThat(changed.beats).isEqualTo(7);
        assertThat(changed.sound).isFalse();
        assertThat(changed.emphasizeFirstBeat).isTrue();
        assertThat(BeatLayout.DEFAULT.beats).isEqualTo(4);
        assertThat(BeatLayout.DEFAULT.sound).isTrue();
    }

    @Test
    void gapsAreCopiedAndUnmodifiable() {
        HashSet<Integer> gaps = new HashSet<>(Arrays.asList(3, 2));
        BeatLayout layout = BeatLayout.DEFAULT.withGaps(gaps);
        gaps.add(4);

        assertThat(layout.gaps).containsExactly(2, 3);
        assertThat(layout.isGap(2)).isTrue();
        assertThat(layout.isGap(4)).isFalse();
        assertThatThrownBy(() -> layout.gaps.add(1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void gapsBeyondBeatCountSurviveShrinkingAndGrowing() {
        BeatLayout layout = BeatLayout.DEFAULT.withGaps(new HashSet<>(Arrays.asList(2, 4)));

        BeatLayout shrunk = layout.withBeats(2);
        assertThat(shrunk.gaps).containsExactly(2, 4);
        assertThat(shrunk.isGap(4)).isTrue();

        assertThat(shrunk.withBeats(6).gaps).containsExactly(2, 4);
    }

    @Test
    void gapsAreCheckedAgainstLargestBeatCount() {
        BeatLayout twoBeats = BeatLayout.DEFAULT.withBeats(2);

        assertThat(twoBeats.withGaps(new HashSet<>(Arrays.asList(BeatLayout.MAX_BEATS))).gaps)
                .containsExactly(BeatLayout.MAX_BEATS);
        assertThatThrownBy(() -> twoBeats.withGaps(new HashSet<>(Arrays.asList(0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> twoBeats.withGaps(new HashSet<>(Arrays.asList(BeatLayout.MAX_BEATS + 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void beatsOfDefaultsWhenLayoutMissing() {
        assertThat(BeatLayout.beatsOf(null)).isEqualTo(4);
        assertThat(BeatLayout.beatsOf(BeatLayout.DEFAULT.withBeats(3))).isEqualTo(3);
    }

    @Test
    void equalityCoversEveryField() {
        assertThat(BeatLayout.DEFAULT.withBeats(3)).isEqualTo(BeatLayout.DEFAULT.withBeats(3));
        assertThat(BeatLayout.DEFAULT.withEmphasizeFirstBeat(false)).isNotEqualTo(BeatLayout.DEFAULT);
    }
}
