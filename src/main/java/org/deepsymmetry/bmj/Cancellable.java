package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * A handle to a deferred callback that was scheduled on a {@link ControlLoop}.
 */
@API(status = API.Status.MAINTAINED)
public interface Cancellable {

    /**
     * Prevent the callback from running if it has not started yet. When called on the control sequence, the
     * callback is guaranteed never to run afterwards. Cancelling twice is harmless.
     */
    void cancel();
}
