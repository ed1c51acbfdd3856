package org.deepsymmetry.bmj;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link ControlLoop} serviced by a single daemon thread. Tasks run in the order they were submitted, and a
 * task that throws is logged without stopping the loop.
 */
@API(status = API.Status.MAINTAINED)
public class ExecutorControlLoop implements ControlLoop, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorControlLoop.class);

    /**
     * The thread name used when none is specified.
     */
    public static final String DEFAULT_THREAD_NAME = "beat-metronome-control";

    /**
     * Runs everything.
     */
    private final ScheduledExecutorService executor;

    /**
     * The thread servicing the executor, once it has been started.
     */
    private final AtomicReference<Thread> controlThread = new AtomicReference<>();

    /**
     * Create a control loop whose thread has the default name.
     */
    public ExecutorControlLoop() {
        this(DEFAULT_THREAD_NAME);
    }

    /**
     * Create a control loop whose thread has a particular name, to help identify it in thread dumps and logs.
     *
     * @param threadName the name to give the control thread
     *
     * @throws IllegalArgumentException if threadName is {@code null} or empty
     */
    public ExecutorControlLoop(final String threadName) {
        if (threadName == null || threadName.isEmpty()) {
            throw new IllegalArgumentException("threadName must not be empty");
        }
        executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, threadName);
                thread.setDaemon(true);
                controlThread.set(thread);
                return thread;
            }
        });
    }

    @Override
    public boolean inControlSequence() {
        return Thread.currentThread() == controlThread.get();
    }

    /**
     * Wraps a task so that anything it throws is logged rather than silently swallowed by the executor.
     *
     * @param task the task to protect
     *
     * @return a task that never throws
     */
    private Runnable guarded(final Runnable task) {
        return new Runnable() {
            @Override
            public void run() {
                try {
                    task.run();
                } catch (Throwable t) {
                    logger.error("Problem running task on control sequence.", t);
                }
            }
        };
    }

    @Override
    public void execute(Runnable task) {
        if (inControlSequence()) {
            task.run();
            return;
        }
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Control loop has been closed.", e);
        }
    }

    @Override
    public void executeAndWait(Runnable task) {
        if (inControlSequence()) {
            task.run();
            return;
        }
        final Future<?> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Control loop has been closed.", e);
        }
        try {
            future.get();
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for task on control sequence.");
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Problem running task on control sequence.", cause);
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0");
        }
        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(guarded(task), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Control loop has been closed.", e);
        }
        return new Cancellable() {
            @Override
            public void cancel() {
                future.cancel(false);
            }
        };
    }

    /**
     * Stop servicing the control sequence. Pending scheduled callbacks are discarded.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.warn("Control thread did not finish within a second of being closed.");
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for control thread to finish.");
            Thread.currentThread().interrupt();
        }
    }
}
