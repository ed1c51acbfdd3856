package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

import static org.apiguardian.api.API.Status.INTERNAL;

/**
 * An immutable value class representing a snapshot of the metronome state.
 */
@API(status = API.Status.MAINTAINED)
public class State {

    /**
     * The tempo at which beats are being produced, or will be once playback starts.
     */
    public final Tempo tempo;

    /**
     * How beats are laid out within each measure.
     */
    public final BeatLayout layout;

    /**
     * Whether the metronome has been asked to play. This reflects the most recent start or stop request, and
     * is never inferred from ticks arriving.
     */
    public final boolean playing;

    /**
     * Whether the authoritative clock is reachable, and therefore which source is producing ticks.
     */
    public final ConnectionState connectionState;

    /**
     * Whether the local fallback scheduler is currently producing silent ticks. Can only be {@code true} when
     * {@link #connectionState} is {@link ConnectionState#DISCONNECTED}.
     */
    public final boolean fallbackActive;

    /**
     * Constructor sets all the immutable data values.
     *
     * @param tempo the current tempo
     * @param layout the current beat layout
     * @param playing whether we have been asked to play
     * @param connectionState whether the authoritative clock is reachable
     * @param fallbackActive whether the fallback scheduler is producing ticks
     */
    @API(status = INTERNAL)
    State(Tempo tempo, BeatLayout layout, boolean playing, ConnectionState connectionState, boolean fallbackActive) {
        this.tempo = tempo;
        this.layout = layout;
        this.playing = playing;
        this.connectionState = connectionState;
        this.fallbackActive = fallbackActive;
    }

    @Override
    public String toString() {
        return "State[tempo:" + tempo + ", layout:" + layout + ", playing:" + playing + ", connectionState:" +
                connectionState + ", fallbackActive:" + fallbackActive + "]";
    }
}
