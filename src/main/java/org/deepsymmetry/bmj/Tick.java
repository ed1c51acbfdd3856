package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * A single pulse of the metronome, on its way from whichever source produced it to the beat dispatcher.
 * Ticks are never stored.
 */
@API(status = API.Status.STABLE)
public final class Tick {

    /**
     * The position within the measure at which this pulse falls, counting from 1.
     */
    public final int beatIndex;

    /**
     * Whether the tick came from the local fallback scheduler rather than the authoritative clock.
     */
    public final boolean fallback;

    @API(status = API.Status.INTERNAL)
    Tick(int beatIndex, boolean fallback) {
        this.beatIndex = beatIndex;
        this.fallback = fallback;
    }

    @Override
    public String toString() {
        return "Tick[beat:" + beatIndex + (fallback ? ", fallback]" : "]");
    }
}
