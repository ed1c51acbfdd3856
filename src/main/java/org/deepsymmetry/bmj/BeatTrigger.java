package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * Implement this interface to be told when a particular beat position has been reached, typically to flash a
 * visual indicator. The {@link BeatDispatcher} holds one for each of the {@link BeatLayout#MAX_BEATS} positions.
 */
@API(status = API.Status.MAINTAINED)
public interface BeatTrigger {
    /**
     * Called on the control sequence when the beat this trigger represents is played. Must return quickly.
     */
    void blink();
}
