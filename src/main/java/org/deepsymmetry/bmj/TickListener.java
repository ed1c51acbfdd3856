package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * Receives ticks from a tick producer. Ticks are delivered synchronously on the control sequence.
 */
@API(status = API.Status.INTERNAL)
public interface TickListener {
    /**
     * Called for each pulse produced.
     *
     * @param tick identifies the beat that was just reached
     */
    void tickReceived(Tick tick);
}
