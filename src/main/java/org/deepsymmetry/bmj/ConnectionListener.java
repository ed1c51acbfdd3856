package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

import static org.apiguardian.api.API.Status.MAINTAINED;

/**
 * Implement this interface if you’d like to be notified when the authoritative clock becomes reachable or goes
 * away. Losing the clock is never an error; the metronome keeps running silently on its fallback scheduler, and
 * this notification is the only way the change is surfaced.
 */
@API(status = MAINTAINED)
public interface ConnectionListener {

    /**
     * Called when the connection state changes.
     *
     * @param state the new connection state
     */
    @API(status = MAINTAINED)
    void connectionChanged(ConnectionState state);
}
