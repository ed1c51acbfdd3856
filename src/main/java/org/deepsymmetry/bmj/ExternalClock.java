package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

import java.util.Set;

/**
 * The settable side of the authoritative clock: the out-of-process service that produces sound and announces
 * each beat it plays by calling {@link TickArbiter#onExternalTick(int)}. An implementation is handed to
 * {@link TickArbiter#onExternalConnected(ExternalClock)} when the service becomes reachable.
 *
 * <p>Setters are called on the arbiter's control sequence and must return quickly. Each value is pushed by
 * a separate call; if one of them throws, the problem is logged, the remaining values are still pushed, and
 * the arbiter carries on with its own state unchanged.</p>
 */
@API(status = API.Status.MAINTAINED)
public interface ExternalClock {

    /**
     * Set the number of beats per measure.
     *
     * @param beats between 1 and {@link BeatLayout#MAX_BEATS}
     */
    void setBeats(int beats);

    /**
     * Set how many clicks to play within each beat.
     *
     * @param subdivisions between 1 and {@link BeatLayout#MAX_SUBDIVISIONS}
     */
    void setSubdivisions(int subdivisions);

    /**
     * Set which beat positions are muted.
     *
     * @param gaps an unmodifiable set of positions counting from 1, possibly empty
     */
    void setGaps(Set<Integer> gaps);

    /**
     * Set the tempo at which beats are played.
     *
     * @param tempo the new tempo, never {@code null}
     */
    void setTempo(Tempo tempo);

    /**
     * Set whether the first beat of each measure should sound different.
     *
     * @param emphasizeFirstBeat {@code true} to emphasize the downbeat
     */
    void setEmphasizeFirstBeat(boolean emphasizeFirstBeat);

    /**
     * Turn the audible click on or off. Beats are reported either way.
     *
     * @param sound {@code true} if the clock should be heard
     */
    void setSound(boolean sound);

    /**
     * Start or stop the clock. While playing, it reports every beat back to the arbiter.
     *
     * @param playing {@code true} if beats should be produced
     */
    void setPlaying(boolean playing);
}
