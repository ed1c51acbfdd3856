package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * Supplies the monotonic timestamps used to measure the gaps between tap gestures.
 */
@API(status = API.Status.MAINTAINED)
public interface TimeSource {

    /**
     * Get the current time. Values are only meaningful when compared with each other.
     *
     * @return milliseconds since an arbitrary, fixed origin
     */
    long nowMillis();

    /**
     * The default time source, backed by {@link System#nanoTime()} so it is unaffected by wall clock adjustments.
     */
    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nowMillis() {
            return System.nanoTime() / 1_000_000L;
        }
    };
}
