package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

/**
 * An immutable value class representing a metronome tempo in whole beats per minute. Instances are always
 * within {@link #MIN} and {@link #MAX}, so code holding a {@code Tempo} never needs to re-validate it. A tempo
 * change always produces a new instance.
 */
@API(status = API.Status.STABLE)
public final class Tempo {

    /**
     * The slowest tempo we support, in beats per minute.
     */
    public static final int MIN = 1;

    /**
     * The fastest tempo we support, in beats per minute.
     */
    public static final int MAX = 400;

    /**
     * The tempo used when nothing else has been chosen.
     */
    public static final int DEFAULT = 100;

    /**
     * The number of milliseconds in a minute, used to convert between tempos and beat intervals.
     */
    public static final long MILLIS_PER_MINUTE = 60_000L;

    /**
     * The tempo in beats per minute.
     */
    public final int value;

    /**
     * Create a tempo with an exact value.
     *
     * @param value the tempo in beats per minute
     *
     * @throws IllegalArgumentException if value is outside the range {@link #MIN} to {@link #MAX}
     */
    @API(status = API.Status.STABLE)
    public Tempo(int value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Tempo must be between " + MIN + " and " + MAX + " BPM.");
        }
        this.value = value;
    }

    /**
     * Checks whether a number of beats per minute can be represented as a tempo.
     *
     * @param bpm a tempo in beats per minute
     *
     * @return {@code true} if it lies within {@link #MIN} and {@link #MAX}
     */
    public static boolean isValid(int bpm) {
        return (bpm >= MIN) && (bpm <= MAX);
    }

    /**
     * Creates a tempo as close as possible to the requested value, pulling anything out of range back to the
     * nearest bound. This is how user input is turned into a tempo; it never fails.
     *
     * @param bpm the desired tempo in beats per minute, possibly out of range
     *
     * @return the closest valid tempo
     */
    @API(status = API.Status.STABLE)
    public static Tempo clamped(long bpm) {
        if (bpm > MAX) {
            return new Tempo(MAX);
        }
        if (bpm < MIN) {
            return new Tempo(MIN);
        }
        return new Tempo((int) bpm);
    }

    /**
     * Get the tempo one beat per minute faster.
     *
     * @return the next faster tempo, or this same tempo if we are already at {@link #MAX}
     */
    public Tempo increment() {
        return (value < MAX) ? new Tempo(value + 1) : this;
    }

    /**
     * Get the tempo one beat per minute slower.
     *
     * @return the next slower tempo, or this same tempo if we are already at {@link #MIN}
     */
    public Tempo decrement() {
        return (value > MIN) ? new Tempo(value - 1) : this;
    }

    /**
     * Calculate how long each beat lasts at this tempo. Uses integer division, so the result is truncated and
     * the effective tempo runs slightly fast at high BPM values (at 400 BPM the interval is 150 ms exactly, but
     * at 350 BPM it is 171 ms rather than 171.43 ms). The authoritative clock is assumed to round the same way.
     *
     * @return the number of milliseconds between beats
     */
    @API(status = API.Status.STABLE)
    public long beatIntervalMillis() {
        return MILLIS_PER_MINUTE / value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Tempo) o).value;
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        return "Tempo[" + value + " BPM]";
    }
}
