package org.deepsymmetry.bmj;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the metronome state and decides which of two sources is producing its ticks: the authoritative clock,
 * an out-of-process service which also makes the sound, or a local {@link FallbackScheduler} which keeps the
 * beats flowing silently whenever that service is unreachable. Exactly one source is live at a time, and
 * every tick from whichever source that is gets passed to the {@link BeatDispatcher}.
 *
 * <p>All state changes happen on a single {@link ControlLoop}. Public methods may be called from any thread;
 * they hand their work to the control sequence, running it immediately if the caller is already there.
 * Getters read atomically maintained values and are safe from anywhere.</p>
 */
@API(status = API.Status.STABLE)
public class TickArbiter {

    private static final Logger logger = LoggerFactory.getLogger(TickArbiter.class);

    /**
     * How many unit steps a large tempo change (such as a long press) applies.
     */
    public static final int LARGE_TEMPO_CHANGE_SIZE = 10;

    /**
     * The control sequence on which all state changes happen.
     */
    private final ControlLoop controlLoop;

    /**
     * Receives every tick, from whichever source produced it.
     */
    private final BeatDispatcher dispatcher;

    /**
     * Supplies tap timestamps.
     */
    private final TimeSource timeSource;

    /**
     * Turns tap gestures into tempo estimates.
     */
    private final TapTempoEstimator tapTempoEstimator;

    /**
     * Produces ticks while the authoritative clock is unavailable.
     */
    private final FallbackScheduler fallbackScheduler;

    /**
     * The current tempo.
     */
    private final AtomicReference<Tempo> tempo = new AtomicReference<>(new Tempo(Tempo.DEFAULT));

    /**
     * The current beat layout.
     */
    private final AtomicReference<BeatLayout> layout = new AtomicReference<>(BeatLayout.DEFAULT);

    /**
     * Whether we have been asked to play.
     */
    private final AtomicBoolean playing = new AtomicBoolean(false);

    /**
     * The tick source which is currently live.
     */
    private final AtomicReference<TickSource> source = new AtomicReference<>();

    /**
     * One of the two states in which the arbiter can be, each of which knows how to route playing state and
     * configuration changes to the tick producer it represents.
     */
    private abstract class TickSource {

        /**
         * @return the connection state this source represents
         */
        abstract ConnectionState connectionState();

        /**
         * Become the live source. The previous source has already been told to {@link #leave()}.
         */
        abstract void enter();

        /**
         * Stop being the live source.
         */
        abstract void leave();

        abstract void playingChanged(boolean nowPlaying);

        abstract void tempoChanged(Tempo newTempo);

        abstract void layoutChanged(BeatLayout newLayout);
    }

    /**
     * The authoritative clock is bound, and is the only thing producing ticks.
     */
    private final class ExternalSource extends TickSource {

        private final ExternalClock clock;

        ExternalSource(ExternalClock clock) {
            this.clock = clock;
        }

        @Override
        ConnectionState connectionState() {
            return ConnectionState.CONNECTED;
        }

        @Override
        void enter() {
            fallbackScheduler.deactivate();  // Unconditionally, even if it was idle.
            pushLayout(clock, layout.get());
            pushTempo(clock, tempo.get());
            pushPlaying(clock, playing.get());
        }

        @Override
        void leave() {
            // The clock is gone or being replaced; there is nothing we can tell it.
        }

        @Override
        void playingChanged(boolean nowPlaying) {
            pushPlaying(clock, nowPlaying);
        }

        @Override
        void tempoChanged(Tempo newTempo) {
            pushTempo(clock, newTempo);
        }

        @Override
        void layoutChanged(BeatLayout newLayout) {
            pushLayout(clock, newLayout);
        }
    }

    /**
     * The authoritative clock is unavailable, so the fallback scheduler produces ticks whenever we are playing.
     * It reads the current tempo and layout each time it fires, so configuration changes need no forwarding.
     */
    private final class FallbackSource extends TickSource {

        @Override
        ConnectionState connectionState() {
            return ConnectionState.DISCONNECTED;
        }

        @Override
        void enter() {
            if (playing.get()) {
                fallbackScheduler.activate();
            }
        }

        @Override
        void leave() {
            fallbackScheduler.deactivate();
        }

        @Override
        void playingChanged(boolean nowPlaying) {
            if (nowPlaying) {
                fallbackScheduler.activate();
            } else {
                fallbackScheduler.deactivate();
            }
        }

        @Override
        void tempoChanged(Tempo newTempo) {
            // Picked up by the next firing.
        }

        @Override
        void layoutChanged(BeatLayout newLayout) {
            // Picked up by the next firing.
        }
    }

    /**
     * Create an arbiter which starts out disconnected and stopped, with the default tempo and layout, and
     * timestamps taps using the system's monotonic clock.
     *
     * @param controlLoop the control sequence on which all state changes will happen
     * @param dispatcher receives every tick
     */
    public TickArbiter(ControlLoop controlLoop, BeatDispatcher dispatcher) {
        this(controlLoop, dispatcher, TimeSource.SYSTEM);
    }

    /**
     * Create an arbiter which starts out disconnected and stopped, with the default tempo and layout.
     *
     * @param controlLoop the control sequence on which all state changes will happen
     * @param dispatcher receives every tick
     * @param timeSource supplies the timestamps of tap gestures
     */
    public TickArbiter(ControlLoop controlLoop, BeatDispatcher dispatcher, TimeSource timeSource) {
        if (controlLoop == null || dispatcher == null || timeSource == null) {
            throw new IllegalArgumentException("controlLoop, dispatcher, and timeSource are all required");
        }
        this.controlLoop = controlLoop;
        this.dispatcher = dispatcher;
        this.timeSource = timeSource;
        tapTempoEstimator = new TapTempoEstimator(timeSource);
        fallbackScheduler = new FallbackScheduler(controlLoop, new FallbackScheduler.Host() {
            @Override
            public Tempo currentTempo() {
                return tempo.get();
            }

            @Override
            public BeatLayout currentLayout() {
                return layout.get();
            }

            @Override
            public boolean fallbackEligible() {
                return playing.get() && source.get().connectionState() == ConnectionState.DISCONNECTED;
            }
        }, new TickListener() {
            @Override
            public void tickReceived(Tick tick) {
                deliverTick(tick);
            }
        });
        source.set(new FallbackSource());
    }

    // ------------------------------------------------------------------------------------------------------------
    // Pushing configuration to the authoritative clock

    /**
     * Sends every part of a layout to the clock. Each value is pushed on its own, so a clock which rejects one
     * of them still receives the rest.
     *
     * @param clock the clock to update
     * @param newLayout the layout it should adopt
     */
    private void pushLayout(ExternalClock clock, BeatLayout newLayout) {
        try {
            clock.setBeats(newLayout.beats);
        } catch (Throwable t) {
            logger.warn("Problem pushing beat count to authoritative clock", t);
        }
        try {
            clock.setSubdivisions(newLayout.subdivisions);
        } catch (Throwable t) {
            logger.warn("Problem pushing subdivisions to authoritative clock", t);
        }
        try {
            clock.setGaps(newLayout.gaps);
        } catch (Throwable t) {
            logger.warn("Problem pushing gaps to authoritative clock", t);
        }
        try {
            clock.setEmphasizeFirstBeat(newLayout.emphasizeFirstBeat);
        } catch (Throwable t) {
            logger.warn("Problem pushing first beat emphasis to authoritative clock", t);
        }
        try {
            clock.setSound(newLayout.sound);
        } catch (Throwable t) {
            logger.warn("Problem pushing sound setting to authoritative clock", t);
        }
    }

    private void pushTempo(ExternalClock clock, Tempo newTempo) {
        try {
            clock.setTempo(newTempo);
        } catch (Throwable t) {
            logger.warn("Problem pushing tempo to authoritative clock", t);
        }
    }

    private void pushPlaying(ExternalClock clock, boolean nowPlaying) {
        try {
            clock.setPlaying(nowPlaying);
        } catch (Throwable t) {
            logger.warn("Problem pushing playing state to authoritative clock", t);
        }
    }

    // ------------------------------------------------------------------------------------------------------------
    // Source transitions

    /**
     * Make a new source live, always stopping the old one before starting the new one so that the two can
     * never produce ticks at the same time.
     *
     * @param next the source which should become live
     */
    private void switchSource(TickSource next) {
        TickSource previous = source.getAndSet(next);
        previous.leave();
        next.enter();
        if (previous.connectionState() != next.connectionState()) {
            deliverConnectionChange(next.connectionState());
        }
        deliverStateUpdate(getState());
    }

    /**
     * Called when the authoritative clock becomes reachable. It is sent our full configuration and playing
     * state, so it adopts what the user has set up locally, and the fallback scheduler is stopped. If a
     * different clock was already connected, the new one replaces it.
     *
     * <p>Does not return until the switch has happened on the control sequence, so no fallback tick can be
     * produced once this method has returned.</p>
     *
     * @param clock the newly reachable clock
     */
    @API(status = API.Status.STABLE)
    public void onExternalConnected(final ExternalClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        controlLoop.executeAndWait(new Runnable() {
            @Override
            public void run() {
                logger.info("Authoritative clock connected, handing tick production over to it.");
                switchSource(new ExternalSource(clock));
            }
        });
    }

    /**
     * Called when the authoritative clock becomes unreachable. If we are playing, the fallback scheduler takes
     * over from the downbeat so the beats continue silently instead of stalling. Does nothing if we were
     * already disconnected.
     */
    @API(status = API.Status.STABLE)
    public void onExternalDisconnected() {
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                if (source.get().connectionState() == ConnectionState.DISCONNECTED) {
                    return;
                }
                logger.info("Authoritative clock disconnected, falling back to silent local ticks.");
                switchSource(new FallbackSource());
            }
        });
    }

    /**
     * Called by the authoritative clock each time it plays a beat. May be called from any thread; the tick is
     * moved onto the control sequence before it is dispatched.
     *
     * @param beatIndex the position within the measure of the beat that was played, counting from 1
     */
    @API(status = API.Status.STABLE)
    public void onExternalTick(final int beatIndex) {
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                deliverTick(new Tick(beatIndex, false));
            }
        });
    }

    /**
     * Passes a tick from either source to the dispatcher, then to any tick listeners. No deduplication is needed, because the sources are
     * never live at the same time.
     *
     * @param tick the tick to deliver
     */
    private void deliverTick(Tick tick) {
        logger.debug("Dispatching {}", tick);
        dispatcher.tickReceived(tick);
        for (TickListener listener : getTickListeners()) {
            try {
                listener.tickReceived(tick);
            } catch (Throwable t) {
                logger.warn("Problem delivering tick to listener", t);
            }
        }
    }

    /**
     * Keeps track of the registered tick listeners.
     */
    private final Set<TickListener> tickListeners = Collections.newSetFromMap(new ConcurrentHashMap<TickListener, Boolean>());

    /**
     * Adds the specified tick listener to receive every tick after it has been dispatched to the beat triggers.
     * {@link Tick#fallback} tells listeners whether the tick is a silent one from the fallback scheduler or was
     * played audibly by the authoritative clock. If {@code listener} is {@code null} or already present in the
     * list of registered listeners, no exception is thrown, and no action is performed.
     *
     * <p>Listeners are called on the control sequence, so they must return quickly.</p>
     *
     * @param listener the tick listener to add
     */
    public void addTickListener(TickListener listener) {
        if (listener != null) {
            tickListeners.add(listener);
        }
    }

    /**
     * Removes the specified tick listener. If {@code listener} is {@code null} or not present in the list of
     * registered listeners, no exception is thrown and no action is performed.
     *
     * @param listener the tick listener to remove
     */
    public void removeTickListener(TickListener listener) {
        if (listener != null) {
            tickListeners.remove(listener);
        }
    }

    /**
     * Get the set of tick listeners that are currently registered.
     *
     * @return the currently registered tick listeners
     */
    public Set<TickListener> getTickListeners() {
        return Collections.unmodifiableSet(new HashSet<>(tickListeners));
    }

    // ------------------------------------------------------------------------------------------------------------
    // Session lifecycle

    /**
     * Begin a session with fresh state: the default tempo and layout, stopped, and disconnected.
     */
    @API(status = API.Status.MAINTAINED)
    public void attach() {
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                resetSession();
                logger.info("Attached with fresh metronome state.");
            }
        });
    }

    /**
     * End the session: the fallback scheduler is cancelled, any authoritative clock is forgotten, and playback
     * stops. Safe to call more than once. Does not return until this has happened on the control sequence.
     */
    @API(status = API.Status.MAINTAINED)
    public void detach() {
        controlLoop.executeAndWait(new Runnable() {
            @Override
            public void run() {
                resetSession();
                logger.info("Detached.");
            }
        });
    }

    private void resetSession() {
        playing.set(false);
        fallbackScheduler.deactivate();
        tempo.set(new Tempo(Tempo.DEFAULT));
        layout.set(BeatLayout.DEFAULT);
        TickSource previous = source.getAndSet(new FallbackSource());
        if (previous.connectionState() != ConnectionState.DISCONNECTED) {
            deliverConnectionChange(ConnectionState.DISCONNECTED);
        }
        deliverStateUpdate(getState());
    }

    // ------------------------------------------------------------------------------------------------------------
    // Playing state

    /**
     * Start playing. Does nothing if we are already playing. Any configuration changes requested before this
     * call are in effect for the very first tick.
     */
    @API(status = API.Status.STABLE)
    public void start() {
        setPlaying(true);
    }

    /**
     * Stop playing. Does nothing if we are already stopped. Does not return until the stop has happened on the
     * control sequence, so the fallback scheduler will not produce another tick once this method has returned.
     */
    @API(status = API.Status.STABLE)
    public void stop() {
        setPlaying(false);
    }

    /**
     * Toggle between playing and stopped. Like {@link #stop()}, does not return until the change has happened.
     */
    @API(status = API.Status.MAINTAINED)
    public void startStop() {
        controlLoop.executeAndWait(new Runnable() {
            @Override
            public void run() {
                applyPlaying(!playing.get());
            }
        });
    }

    private void setPlaying(final boolean nowPlaying) {
        Runnable change = new Runnable() {
            @Override
            public void run() {
                applyPlaying(nowPlaying);
            }
        };
        if (nowPlaying) {
            controlLoop.execute(change);
        } else {
            controlLoop.executeAndWait(change);
        }
    }

    private void applyPlaying(boolean nowPlaying) {
        if (playing.getAndSet(nowPlaying) == nowPlaying) {
            return;
        }
        logger.info(nowPlaying ? "Starting playback." : "Stopping playback.");
        source.get().playingChanged(nowPlaying);
        deliverStateUpdate(getState());
    }

    /**
     * Check whether we have been asked to play.
     *
     * @return {@code true} if the most recent start or stop request was a start
     */
    public boolean isPlaying() {
        return playing.get();
    }

    // ------------------------------------------------------------------------------------------------------------
    // Tempo

    /**
     * Set the tempo from user input. Values out of range are pulled to the nearest bound rather than rejected.
     *
     * @param bpm the desired tempo in beats per minute
     */
    @API(status = API.Status.STABLE)
    public void setTempo(int bpm) {
        onConfigChanged(Tempo.clamped(bpm));
    }

    /**
     * Get the current tempo.
     *
     * @return the tempo in beats per minute
     */
    @API(status = API.Status.STABLE)
    public int getTempo() {
        Tempo current = tempo.get();
        return (current == null) ? Tempo.DEFAULT : current.value;
    }

    /**
     * Replace the tempo. If the authoritative clock is connected it is told right away; the fallback scheduler
     * picks the change up on its next beat.
     *
     * @param newTempo the new tempo
     */
    @API(status = API.Status.STABLE)
    public void onConfigChanged(final Tempo newTempo) {
        if (newTempo == null) {
            throw new IllegalArgumentException("tempo must not be null");
        }
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                applyTempo(newTempo);
            }
        });
    }

    private void applyTempo(Tempo newTempo) {
        if (newTempo.equals(tempo.getAndSet(newTempo))) {
            return;
        }
        logger.debug("Tempo changed to {}", newTempo);
        source.get().tempoChanged(newTempo);
        deliverStateUpdate(getState());
    }

    /**
     * Make the tempo one beat per minute faster, unless it is already as fast as it can go.
     */
    @API(status = API.Status.MAINTAINED)
    public void incrementTempo() {
        stepTempo(1, true);
    }

    /**
     * Make the tempo one beat per minute slower, unless it is already as slow as it can go.
     */
    @API(status = API.Status.MAINTAINED)
    public void decrementTempo() {
        stepTempo(1, false);
    }

    /**
     * Apply {@link #LARGE_TEMPO_CHANGE_SIZE} single increments, each of which stops at the upper bound.
     */
    @API(status = API.Status.MAINTAINED)
    public void incrementTempoLarge() {
        stepTempo(LARGE_TEMPO_CHANGE_SIZE, true);
    }

    /**
     * Apply {@link #LARGE_TEMPO_CHANGE_SIZE} single decrements, each of which stops at the lower bound.
     */
    @API(status = API.Status.MAINTAINED)
    public void decrementTempoLarge() {
        stepTempo(LARGE_TEMPO_CHANGE_SIZE, false);
    }

    private void stepTempo(final int steps, final boolean faster) {
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                for (int i = 0; i < steps; i++) {
                    Tempo current = tempo.get();
                    applyTempo(faster ? current.increment() : current.decrement());
                }
            }
        });
    }

    /**
     * Record a tap gesture at the current time and, once there are enough recent taps to estimate a tempo,
     * adopt the estimate.
     */
    @API(status = API.Status.STABLE)
    public void onTapTempo() {
        final long now = timeSource.nowMillis();
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                Tempo estimate = tapTempoEstimator.tap(now);
                if (estimate != null) {
                    applyTempo(estimate);
                }
            }
        });
    }

    // ------------------------------------------------------------------------------------------------------------
    // Beat layout

    /**
     * Get the current beat layout.
     *
     * @return how beats are laid out within each measure
     */
    @API(status = API.Status.STABLE)
    public BeatLayout getBeatLayout() {
        return layout.get();
    }

    /**
     * Replace the beat layout. If the authoritative clock is connected it is told right away; the fallback
     * scheduler picks the new beat count up on its next beat.
     *
     * @param newLayout the new layout
     */
    @API(status = API.Status.STABLE)
    public void onConfigChanged(final BeatLayout newLayout) {
        if (newLayout == null) {
            throw new IllegalArgumentException("layout must not be null");
        }
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                applyLayout(newLayout);
            }
        });
    }

    private void applyLayout(BeatLayout newLayout) {
        if (newLayout.equals(layout.getAndSet(newLayout))) {
            return;
        }
        logger.debug("Beat layout changed to {}", newLayout);
        source.get().layoutChanged(newLayout);
        deliverStateUpdate(getState());
    }

    /**
     * A change to one part of the current layout, applied on the control sequence so it sees the latest layout.
     */
    private interface LayoutEdit {
        BeatLayout apply(BeatLayout current);
    }

    private void editLayout(final LayoutEdit edit) {
        controlLoop.execute(new Runnable() {
            @Override
            public void run() {
                applyLayout(edit.apply(layout.get()));
            }
        });
    }

    /**
     * Set the number of beats per measure.
     *
     * @param beats the new beat count
     *
     * @throws IllegalArgumentException if beats is outside the range 1 to {@link BeatLayout#MAX_BEATS}
     */
    public void setBeats(final int beats) {
        if ((beats < 1) || (beats > BeatLayout.MAX_BEATS)) {
            throw new IllegalArgumentException("beats must be in range 1-" + BeatLayout.MAX_BEATS);
        }
        editLayout(new LayoutEdit() {
            @Override
            public BeatLayout apply(BeatLayout current) {
                return current.withBeats(beats);
            }
        });
    }

    /**
     * Set the number of subdivisions per beat.
     *
     * @param subdivisions the new subdivision count
     *
     * @throws IllegalArgumentException if subdivisions is outside the range 1 to {@link BeatLayout#MAX_SUBDIVISIONS}
     */
    public void setSubdivisions(final int subdivisions) {
        if ((subdivisions < 1) || (subdivisions > BeatLayout.MAX_SUBDIVISIONS)) {
            throw new IllegalArgumentException("subdivisions must be in range 1-" + BeatLayout.MAX_SUBDIVISIONS);
        }
        editLayout(new LayoutEdit() {
            @Override
            public BeatLayout apply(BeatLayout current) {
                return current.withSubdivisions(subdivisions);
            }
        });
    }

    /**
     * Set which beat positions are muted.
     *
     * @param gaps the muted beat positions, counting from 1
     *
     * @throws IllegalArgumentException if any position is outside the range 1 to {@link BeatLayout#MAX_BEATS}
     */
    public void setGaps(Set<Integer> gaps) {
        final BeatLayout validated = BeatLayout.DEFAULT.withGaps(gaps);  // Fail here, not on the control sequence.
        editLayout(new LayoutEdit() {
            @Override
            public BeatLayout apply(BeatLayout current) {
                return current.withGaps(validated.gaps);
            }
        });
    }

    /**
     * Set whether the authoritative clock should make the first beat of each measure sound different.
     *
     * @param emphasizeFirstBeat {@code true} if the downbeat should be emphasized
     */
    public void setEmphasizeFirstBeat(final boolean emphasizeFirstBeat) {
        editLayout(new LayoutEdit() {
            @Override
            public BeatLayout apply(BeatLayout current) {
                return current.withEmphasizeFirstBeat(emphasizeFirstBeat);
            }
        });
    }

    /**
     * Set whether the authoritative clock should produce sound. The fallback scheduler is always silent.
     *
     * @param sound {@code true} if beats should be audible
     */
    public void setSound(final boolean sound) {
        editLayout(new LayoutEdit() {
            @Override
            public BeatLayout apply(BeatLayout current) {
                return current.withSound(sound);
            }
        });
    }

    // ------------------------------------------------------------------------------------------------------------
    // State reporting

    /**
     * Check whether the authoritative clock is currently reachable.
     *
     * @return the current connection state
     */
    @API(status = API.Status.STABLE)
    public ConnectionState getConnectionState() {
        return source.get().connectionState();
    }

    /**
     * Check whether the fallback scheduler is currently producing ticks.
     *
     * @return {@code true} if silent local ticks are being produced
     */
    public boolean isFallbackActive() {
        return fallbackScheduler.isActive();
    }

    /**
     * Get the current metronome state.
     *
     * @return a snapshot of the tempo, layout, playing state, and tick source
     */
    @API(status = API.Status.STABLE)
    public State getState() {
        return new State(tempo.get(), layout.get(), playing.get(), getConnectionState(), isFallbackActive());
    }

    /**
     * Keeps track of the registered state listeners.
     */
    private final Set<StateListener> stateListeners = Collections.newSetFromMap(new ConcurrentHashMap<StateListener, Boolean>());

    /**
     * Adds the specified state listener to receive the current state whenever it changes. If {@code listener}
     * is {@code null} or already present in the list of registered listeners, no exception is thrown, and no
     * action is performed.
     *
     * <p>Listeners are called on the control sequence, so they must return quickly.</p>
     *
     * @param listener the state listener to add
     */
    public void addStateListener(StateListener listener) {
        if (listener != null) {
            stateListeners.add(listener);
        }
    }

    /**
     * Removes the specified state listener so it no longer receives state updates. If {@code listener} is
     * {@code null} or not present in the list of registered listeners, no exception is thrown and no action
     * is performed.
     *
     * @param listener the state listener to remove
     */
    public void removeStateListener(StateListener listener) {
        if (listener != null) {
            stateListeners.remove(listener);
        }
    }

    /**
     * Get the set of state listeners that are currently registered.
     *
     * @return the currently registered state listeners
     */
    public Set<StateListener> getStateListeners() {
        return Collections.unmodifiableSet(new HashSet<>(stateListeners));
    }

    private void deliverStateUpdate(State state) {
        for (StateListener listener : getStateListeners()) {
            try {
                listener.metronomeStateChanged(state);
            } catch (Throwable t) {
                logger.warn("Problem delivering state update to listener", t);
            }
        }
    }

    /**
     * Keeps track of the registered connection listeners.
     */
    private final Set<ConnectionListener> connectionListeners = Collections.newSetFromMap(new ConcurrentHashMap<ConnectionListener, Boolean>());

    /**
     * Adds the specified connection listener to be notified when the authoritative clock comes or goes.
     * If {@code listener} is {@code null} or already present in the list of registered listeners,
     * no exception is thrown, and no action is performed.
     *
     * <p>Listeners are called on the control sequence, so they must return quickly.</p>
     *
     * @param listener the connection listener to add
     */
    public void addConnectionListener(ConnectionListener listener) {
        if (listener != null) {
            connectionListeners.add(listener);
        }
    }

    /**
     * Removes the specified connection listener. If {@code listener} is {@code null} or not present
     * in the list of registered listeners, no exception is thrown and no action is performed.
     *
     * @param listener the connection listener to remove
     */
    public void removeConnectionListener(ConnectionListener listener) {
        if (listener != null) {
            connectionListeners.remove(listener);
        }
    }

    /**
     * Get the set of connection listeners that are currently registered.
     *
     * @return the currently registered connection listeners
     */
    public Set<ConnectionListener> getConnectionListeners() {
        return Collections.unmodifiableSet(new HashSet<>(connectionListeners));
    }

    private void deliverConnectionChange(ConnectionState state) {
        for (ConnectionListener listener : getConnectionListeners()) {
            try {
                listener.connectionChanged(state);
            } catch (Throwable t) {
                logger.warn("Problem delivering connection change to listener", t);
            }
        }
    }
}
