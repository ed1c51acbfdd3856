package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

import static org.apiguardian.api.API.Status.MAINTAINED;

/**
 * Implement this interface if you would like to receive state updates whenever the tempo, layout, playing state,
 * or tick source of a {@link TickArbiter} changes.
 */
@API(status = MAINTAINED)
public interface StateListener {
    /**
     * Called on the control sequence after every change has been applied.
     * @param state the new state of the metronome
     */
    void metronomeStateChanged(State state);
}
