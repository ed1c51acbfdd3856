package org.deepsymmetry.bmj;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Produces silent, visual-only ticks locally while the authoritative clock is unavailable. Each firing emits a
 * tick for the current beat, advances the beat within the measure, and schedules the next firing one beat
 * interval later, reading the tempo and layout afresh each time so configuration changes take effect on the
 * next beat without any separate propagation.
 *
 * <p>Intervals are measured from when each firing runs, not from when it was intended to run, so dispatch
 * latency accumulates across beats. All methods must be called on the control sequence.</p>
 */
@API(status = API.Status.INTERNAL)
public class FallbackScheduler {

    private static final Logger logger = LoggerFactory.getLogger(FallbackScheduler.class);

    /**
     * Supplies the live configuration and eligibility that each firing consults.
     */
    @API(status = API.Status.INTERNAL)
    public interface Host {

        /**
         * @return the tempo to schedule the next beat at, or {@code null} to use {@link Tempo#DEFAULT}
         */
        Tempo currentTempo();

        /**
         * @return the layout bounding the beat cycle, or {@code null} to use {@link BeatLayout#DEFAULT_BEATS}
         */
        BeatLayout currentLayout();

        /**
         * @return {@code true} while we are playing and the authoritative clock is not connected
         */
        boolean fallbackEligible();
    }

    /**
     * The control sequence our firings are scheduled on.
     */
    private final ControlLoop controlLoop;

    /**
     * Where configuration and eligibility come from.
     */
    private final Host host;

    /**
     * Where our ticks go.
     */
    private final TickListener tickListener;

    /**
     * The beat that will be emitted by the next firing.
     */
    private final AtomicInteger currentBeat = new AtomicInteger(1);

    /**
     * Whether we have been activated and not since deactivated.
     */
    private final AtomicBoolean active = new AtomicBoolean(false);

    /**
     * Counts activations, so a firing left over from an earlier activation can recognize itself and do nothing.
     */
    private final AtomicInteger activationNumber = new AtomicInteger(0);

    /**
     * The handle for the firing currently waiting to run, if any.
     */
    private final AtomicReference<Cancellable> pending = new AtomicReference<>();

    /**
     * Create a scheduler; it stays idle until {@link #activate()} is called.
     *
     * @param controlLoop the control sequence on which to schedule firings
     * @param host supplies the current tempo, layout, and whether we are still eligible to run
     * @param tickListener receives each tick we produce
     */
    public FallbackScheduler(ControlLoop controlLoop, Host host, TickListener tickListener) {
        if (controlLoop == null || host == null || tickListener == null) {
            throw new IllegalArgumentException("controlLoop, host, and tickListener are all required");
        }
        this.controlLoop = controlLoop;
        this.host = host;
        this.tickListener = tickListener;
    }

    /**
     * Calculate the beat which follows another, wrapping back to the downbeat at the end of the measure.
     *
     * @param beat the current beat, counting from 1
     * @param beats the number of beats in the measure, which will be clamped to the range 1 to 8
     *
     * @return the next beat, counting from 1
     */
    public static int nextBeat(int beat, int beats) {
        int bounded = Math.max(1, Math.min(BeatLayout.MAX_BEATS, beats));
        return (beat >= bounded) ? 1 : beat + 1;
    }

    /**
     * Calculate how long to wait before the next firing.
     *
     * @param tempo the current tempo, or {@code null} if none has been chosen
     *
     * @return the truncated beat interval in milliseconds
     */
    public static long intervalMillis(Tempo tempo) {
        return (tempo == null) ? new Tempo(Tempo.DEFAULT).beatIntervalMillis() : tempo.beatIntervalMillis();
    }

    /**
     * Start producing ticks from the downbeat. Any firing still pending from an earlier activation is cancelled
     * first, so restarting never doubles the tick rate. The first tick is emitted as soon as the control
     * sequence is free.
     */
    public void activate() {
        cancelPending();
        currentBeat.set(1);
        active.set(true);
        logger.info("Activating fallback scheduler for silent, visual-only beats.");
        scheduleFiring(activationNumber.incrementAndGet(), 0);
    }

    /**
     * Stop producing ticks. Once this returns, no further ticks will be emitted until the next activation.
     * Deactivating an idle scheduler does nothing.
     */
    public void deactivate() {
        activationNumber.incrementAndGet();
        cancelPending();
        if (active.getAndSet(false)) {
            logger.info("Deactivated fallback scheduler.");
        }
    }

    /**
     * Check whether we are currently producing ticks.
     *
     * @return {@code true} if we have been activated and not deactivated
     */
    public boolean isActive() {
        return active.get();
    }

    /**
     * Get the beat that the next firing will emit.
     *
     * @return the beat within the measure, counting from 1
     */
    public int getCurrentBeat() {
        return currentBeat.get();
    }

    private void cancelPending() {
        Cancellable previous = pending.getAndSet(null);
        if (previous != null) {
            previous.cancel();
        }
    }

    private void scheduleFiring(final int forActivation, long delayMillis) {
        pending.set(controlLoop.schedule(new Runnable() {
            @Override
            public void run() {
                fire(forActivation);
            }
        }, delayMillis));
    }

    /**
     * Emits one tick and schedules the next, as long as we are still the live source of ticks.
     *
     * @param forActivation the activation which scheduled this firing
     */
    private void fire(int forActivation) {
        if (forActivation != activationNumber.get() || !active.get()) {
            return;  // Left over from an earlier activation.
        }
        if (!host.fallbackEligible()) {
            logger.debug("No longer eligible to produce fallback ticks, not rescheduling.");
            active.set(false);
            pending.set(null);
            return;
        }
        int beat = currentBeat.get();
        tickListener.tickReceived(new Tick(beat, true));
        if (forActivation != activationNumber.get()) {
            return;  // The tick caused us to be deactivated or restarted.
        }
        currentBeat.set(nextBeat(beat, BeatLayout.beatsOf(host.currentLayout())));
        scheduleFiring(forActivation, intervalMillis(host.currentTempo()));
    }
}
