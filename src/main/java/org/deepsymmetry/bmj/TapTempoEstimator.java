package org.deepsymmetry.bmj;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Estimates a tempo from a series of tap gestures, averaging the gaps between the taps that fall within a
 * rolling time window. Old taps age out of the window on their own, so there is nothing to reset.
 *
 * <p>Not thread safe; the {@link TickArbiter} only calls it from its control sequence.</p>
 */
@API(status = API.Status.MAINTAINED)
public class TapTempoEstimator {

    private static final Logger logger = LoggerFactory.getLogger(TapTempoEstimator.class);

    /**
     * How far back, in milliseconds, taps are considered when no other window is configured.
     */
    public static final long DEFAULT_WINDOW_MILLIS = 5_000L;

    /**
     * Taps older than this many milliseconds are discarded before a new tap is recorded.
     */
    private final long windowMillis;

    /**
     * Supplies tap timestamps.
     */
    private final TimeSource timeSource;

    /**
     * The timestamps of the taps still within the window, oldest first.
     */
    private final Deque<Long> taps = new ArrayDeque<>();

    /**
     * Create an estimator with the default five second window.
     *
     * @param timeSource supplies the time at which each tap happens
     */
    public TapTempoEstimator(TimeSource timeSource) {
        this(timeSource, DEFAULT_WINDOW_MILLIS);
    }

    /**
     * Create an estimator with a specific window.
     *
     * @param timeSource supplies the time at which each tap happens
     * @param windowMillis how many milliseconds of taps should contribute to the estimate
     *
     * @throws IllegalArgumentException if timeSource is {@code null} or windowMillis is not positive
     */
    public TapTempoEstimator(TimeSource timeSource, long windowMillis) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource must not be null");
        }
        if (windowMillis < 1) {
            throw new IllegalArgumentException("windowMillis must be positive");
        }
        this.timeSource = timeSource;
        this.windowMillis = windowMillis;
    }

    /**
     * Get the length of the window over which taps are averaged.
     *
     * @return the window length in milliseconds
     */
    public long getWindowMillis() {
        return windowMillis;
    }

    /**
     * Record a tap happening right now, according to our time source.
     *
     * @return the newly estimated tempo, or {@code null} if there is not yet enough information for one
     */
    public Tempo tap() {
        return tap(timeSource.nowMillis());
    }

    /**
     * Record a tap which happened at a specific time, and estimate the tempo implied by the taps in the window.
     * A lone tap, or taps so close together that their average gap truncates to zero milliseconds, produce no
     * estimate; this is not an error, the tempo should simply be left alone.
     *
     * @param now the time of the tap in milliseconds, from the same origin as earlier taps
     *
     * @return the newly estimated tempo, clamped to the supported range, or {@code null} if there is no estimate
     */
    public Tempo tap(long now) {
        pruneOldTaps(now);
        taps.addLast(now);
        long interval = averageTapIntervalMillis();
        if (interval <= 0) {
            return null;
        }
        Tempo estimate = Tempo.clamped(Tempo.MILLIS_PER_MINUTE / interval);
        logger.debug("Estimated {} from {} taps averaging {} ms apart", estimate, taps.size(), interval);
        return estimate;
    }

    /**
     * Get the number of taps currently contributing to the estimate.
     *
     * @return how many taps are in the window
     */
    public int getTapCount() {
        return taps.size();
    }

    /**
     * Discard any taps that happened more than the window length before the specified time.
     *
     * @param now the current time in milliseconds
     */
    private void pruneOldTaps(long now) {
        Iterator<Long> iterator = taps.iterator();
        while (iterator.hasNext()) {
            if (now - iterator.next() > windowMillis) {
                iterator.remove();
            }
        }
    }

    /**
     * Calculate the mean gap between successive taps, truncated to whole milliseconds.
     *
     * @return the average gap, or zero if there are fewer than two taps
     */
    private long averageTapIntervalMillis() {
        if (taps.size() < 2) {
            return 0;
        }
        long total = 0;
        Long previous = null;
        for (Long tap : taps) {
            if (previous != null) {
                total += tap - previous;
            }
            previous = tap;
        }
        return (long) ((double) total / (taps.size() - 1));
    }
}
