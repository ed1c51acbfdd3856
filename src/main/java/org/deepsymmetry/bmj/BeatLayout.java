package org.deepsymmetry.bmj;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An immutable value class describing how beats are laid out within a measure, and how they should sound.
 * A change to any part of the layout produces a whole new instance.
 */
@API(status = API.Status.STABLE)
public final class BeatLayout {

    /**
     * The largest number of beats a measure can contain; there is one visual trigger for each.
     */
    public static final int MAX_BEATS = 8;

    /**
     * The largest number of subdivisions a beat can be split into.
     */
    public static final int MAX_SUBDIVISIONS = 4;

    /**
     * The beat count used when no layout has been configured.
     */
    public static final int DEFAULT_BEATS = 4;

    /**
     * The layout a session starts with: four beats, no subdivisions or gaps, first beat emphasized, sound on.
     */
    public static final BeatLayout DEFAULT = new BeatLayout(DEFAULT_BEATS, 1, Collections.<Integer>emptySet(),
            true, true);

    /**
     * The number of pulses in each measure, from 1 to {@link #MAX_BEATS}.
     */
    public final int beats;

    /**
     * The number of audible subdivisions within each beat, from 1 to {@link #MAX_SUBDIVISIONS}.
     */
    public final int subdivisions;

    /**
     * The beat positions (counting from 1) that should be muted.
     */
    public final SortedSet<Integer> gaps;

    /**
     * Whether the first beat of each measure should sound different from the others.
     */
    public final boolean emphasizeFirstBeat;

    /**
     * Whether the authoritative clock should produce sound at all.
     */
    public final boolean sound;

    /**
     * Constructor sets all the immutable data values.
     *
     * @param beats the number of beats per measure
     * @param subdivisions the number of subdivisions per beat
     * @param gaps the beat positions which should be muted
     * @param emphasizeFirstBeat whether the downbeat should be emphasized
     * @param sound whether sound should be produced
     *
     * @throws IllegalArgumentException if beats, subdivisions, or any gap position is out of range
     */
    @API(status = API.Status.STABLE)
    public BeatLayout(int beats, int subdivisions, Set<Integer> gaps, boolean emphasizeFirstBeat, boolean sound) {
        if ((beats < 1) || (beats > MAX_BEATS)) {
            throw new IllegalArgumentException("beats must be in range 1-" + MAX_BEATS);
        }
        if ((subdivisions < 1) || (subdivisions > MAX_SUBDIVISIONS)) {
            throw new IllegalArgumentException("subdivisions must be in range 1-" + MAX_SUBDIVISIONS);
        }
        TreeSet<Integer> gapCopy = new TreeSet<>();
        if (gaps != null) {
            for (Integer gap : gaps) {
                if ((gap == null) || (gap < 1) || (gap > MAX_BEATS)) {
                    throw new IllegalArgumentException("gap positions must be in range 1-" + MAX_BEATS);
                }
                gapCopy.add(gap);
            }
        }
        this.beats = beats;
        this.subdivisions = subdivisions;
        this.gaps = Collections.unmodifiableSortedSet(gapCopy);
        this.emphasizeFirstBeat = emphasizeFirstBeat;
        this.sound = sound;
    }

    /**
     * Find the beat count to cycle through for a layout that may not have been configured. Always returns
     * a value between 1 and {@link #MAX_BEATS}.
     *
     * @param layout the current layout, or {@code null} if there is none
     *
     * @return the number of beats per measure, {@link #DEFAULT_BEATS} if there is no layout
     */
    public static int beatsOf(BeatLayout layout) {
        int beats = (layout == null) ? DEFAULT_BEATS : layout.beats;
        return Math.max(1, Math.min(MAX_BEATS, beats));
    }

    /**
     * Check whether a beat position is muted in this layout.
     *
     * @param beat the position within the measure, counting from 1
     *
     * @return {@code true} if that beat falls on a gap
     */
    public boolean isGap(int beat) {
        return gaps.contains(beat);
    }

    /**
     * Get a copy of this layout with a different beat count.
     *
     * @param beats the number of beats per measure
     *
     * @return the new layout
     *
     * @throws IllegalArgumentException if the new value is out of range
     */
    public BeatLayout withBeats(int beats) {
        return new BeatLayout(beats, subdivisions, gaps, emphasizeFirstBeat, sound);
    }

    /**
     * Get a copy of this layout with a different number of subdivisions.
     *
     * @param subdivisions the number of clicks within each beat
     *
     * @return the new layout
     *
     * @throws IllegalArgumentException if the new value is out of range
     */
    public BeatLayout withSubdivisions(int subdivisions) {
        return new BeatLayout(beats, subdivisions, gaps, emphasizeFirstBeat, sound);
    }

    /**
     * Get a copy of this layout with different muted beats. Gap positions are checked against
     * {@link #MAX_BEATS}, not the current beat count, so they survive the beat count shrinking and growing again.
     *
     * @param gaps the beat positions which should be muted, may be {@code null} for none
     *
     * @return the new layout
     *
     * @throws IllegalArgumentException if the new value is out of range
     */
    public BeatLayout withGaps(Set<Integer> gaps) {
        return new BeatLayout(beats, subdivisions, gaps, emphasizeFirstBeat, sound);
    }

    /**
     * Get a copy of this layout with first beat emphasis turned on or off.
     *
     * @param emphasizeFirstBeat whether the downbeat should sound different
     *
     * @return the new layout
     */
    public BeatLayout withEmphasizeFirstBeat(boolean emphasizeFirstBeat) {
        return new BeatLayout(beats, subdivisions, gaps, emphasizeFirstBeat, sound);
    }

    /**
     * Get a copy of this layout with sound turned on or off.
     *
     * @param sound whether the authoritative clock should be audible
     *
     * @return the new layout
     */
    public BeatLayout withSound(boolean sound) {
        return new BeatLayout(beats, subdivisions, gaps, emphasizeFirstBeat, sound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BeatLayout other = (BeatLayout) o;
        return beats == other.beats && subdivisions == other.subdivisions && gaps.equals(other.gaps) &&
                emphasizeFirstBeat == other.emphasizeFirstBeat && sound == other.sound;
    }

    @Override
    public int hashCode() {
        int result = beats;
        result = 31 * result + subdivisions;
        result = 31 * result + gaps.hashCode();
        result = 31 * result + (emphasizeFirstBeat ? 1 : 0);
        result = 31 * result + (sound ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "BeatLayout[beats:" + beats + ", subdivisions:" + subdivisions + ", gaps:" + gaps +
                ", emphasizeFirstBeat:" + emphasizeFirstBeat + ", sound:" + sound + "]";
    }
}
