package org.deepsymmetry.bmj;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps each tick to the visual trigger for its beat position. Holds no state beyond the triggers themselves;
 * ticks for positions outside 1 to {@link BeatLayout#MAX_BEATS} are ignored, which covers the moment when a
 * tick produced under an old layout arrives after the beat count has shrunk.
 */
@API(status = API.Status.MAINTAINED)
public class BeatDispatcher implements TickListener {

    private static final Logger logger = LoggerFactory.getLogger(BeatDispatcher.class);

    /**
     * The triggers, indexed by beat position minus one.
     */
    private final List<BeatTrigger> triggers;

    /**
     * Create a dispatcher for a full set of triggers.
     *
     * @param triggers one trigger for each beat position, in order, starting with the downbeat
     *
     * @throws IllegalArgumentException if there are not exactly {@link BeatLayout#MAX_BEATS} non-null triggers
     */
    public BeatDispatcher(List<? extends BeatTrigger> triggers) {
        if (triggers == null || triggers.size() != BeatLayout.MAX_BEATS) {
            throw new IllegalArgumentException("Exactly " + BeatLayout.MAX_BEATS + " beat triggers are required.");
        }
        if (triggers.contains(null)) {
            throw new IllegalArgumentException("Beat triggers must not be null.");
        }
        this.triggers = Collections.unmodifiableList(new ArrayList<>(triggers));
    }

    /**
     * Find the trigger for a beat position.
     *
     * @param beat the position within the measure, counting from 1
     *
     * @return the corresponding trigger, or {@code null} if the position is out of range
     */
    public BeatTrigger getTrigger(int beat) {
        if (beat < 1 || beat > triggers.size()) {
            return null;
        }
        return triggers.get(beat - 1);
    }

    /**
     * Blink the trigger for a beat position, if there is one.
     *
     * @param beat the position within the measure, counting from 1
     */
    public void dispatch(int beat) {
        BeatTrigger trigger = getTrigger(beat);
        if (trigger == null) {
            logger.debug("Ignoring tick for unsupported beat {}", beat);
            return;
        }
        try {
            trigger.blink();
        } catch (Throwable t) {
            logger.warn("Problem blinking trigger for beat " + beat, t);
        }
    }

    @Override
    public void tickReceived(Tick tick) {
        dispatch(tick.beatIndex);
    }
}
