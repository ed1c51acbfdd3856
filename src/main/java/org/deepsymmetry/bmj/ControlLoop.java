package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * The single logical control sequence on which all metronome state is read and changed. Configuration changes,
 * tick notifications from the authoritative clock, and fallback scheduler callbacks are all serviced here, one
 * at a time, so no locking is needed around the state they touch.
 *
 * <p>Collaborators on other threads reach the state only by handing work to {@link #execute(Runnable)}.</p>
 */
@API(status = API.Status.MAINTAINED)
public interface ControlLoop {

    /**
     * Run a task on the control sequence. If the caller is already on it, the task runs before this method
     * returns; otherwise it is queued behind any work submitted earlier.
     *
     * @param task the work to perform
     */
    void execute(Runnable task);

    /**
     * Run a task on the control sequence and wait for it to finish. If the caller is already on it, the task
     * simply runs before this method returns, so it is safe to call from within other control sequence work.
     *
     * <p>If the calling thread is interrupted while waiting, the interrupt status is restored and this returns
     * before the task is known to have run; it will still run in its turn.</p>
     *
     * @param task the work to perform
     *
     * @throws IllegalStateException if the control sequence is no longer running
     */
    void executeAndWait(Runnable task);

    /**
     * Arrange for a task to run on the control sequence once a delay has passed.
     *
     * @param task the work to perform
     * @param delayMillis how long to wait, in milliseconds; zero means as soon as the sequence is free
     *
     * @return a handle that can prevent the task from running
     *
     * @throws IllegalArgumentException if delayMillis is negative
     */
    Cancellable schedule(Runnable task, long delayMillis);

    /**
     * Check whether the calling thread is currently servicing the control sequence.
     *
     * @return {@code true} if state may be touched directly
     */
    boolean inControlSequence();
}
