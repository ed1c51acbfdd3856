package org.deepsymmetry.bmj;

import java.util.ArrayList;
import java.util.List;

/**
 * A beat trigger that records the beat it stands for into a shared log each time it blinks.
 */
class RecordingTrigger implements BeatTrigger {

    final int beat;
    final List<Integer> log;

    RecordingTrigger(int beat, List<Integer> log) {
        this.beat = beat;
        this.log = log;
    }

    @Override
    public void blink() {
        log.add(beat);
    }

    static List<RecordingTrigger> fullSet(List<Integer> log) {
        List<RecordingTrigger> triggers = new ArrayList<>();
        for (int beat = 1; beat <= BeatLayout.MAX_BEATS; beat++) {
            triggers.add(new RecordingTrigger(beat, log));
        }
        return triggers;
    }
}
