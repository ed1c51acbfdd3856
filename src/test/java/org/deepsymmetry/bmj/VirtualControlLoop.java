package org.deepsymmetry.bmj;

import java.util.PriorityQueue;

/**
 * A {@link ControlLoop} whose clock only moves when a test advances it. Everything runs on the test thread.
 */
class VirtualControlLoop implements ControlLoop {

    private static final class Task implements Comparable<Task> {
        final long due;
        final long sequence;
        final Runnable runnable;
        boolean cancelled;

        Task(long due, long sequence, Runnable runnable) {
            this.due = due;
            this.sequence = sequence;
            this.runnable = runnable;
        }

        @Override
        public int compareTo(Task other) {
            if (due != other.due) {
                return Long.compare(due, other.due);
            }
            return Long.compare(sequence, other.sequence);
        }
    }

    private final PriorityQueue<Task> tasks = new PriorityQueue<>();
    private long now;
    private long sequence;

    @Override
    public void execute(Runnable task) {
        task.run();
    }

    @Override
    public void executeAndWait(Runnable task) {
        task.run();
    }

    @Override
    public Cancellable schedule(Runnable runnable, long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0");
        }
        final Task task = new Task(now + delayMillis, sequence++, runnable);
        tasks.add(task);
        return () -> {
            task.cancelled = true;
            tasks.remove(task);
        };
    }

    @Override
    public boolean inControlSequence() {
        return true;
    }

    long now() {
        return now;
    }

    /**
     * Runs every task that falls due within the next {@code millis}, in order, including ones scheduled along
     * the way.
     */
    void advanceBy(long millis) {
        long target = now + millis;
        while (!tasks.isEmpty() && tasks.peek().due <= target) {
            Task task = tasks.poll();
            now = task.due;
            if (!task.cancelled) {
                task.runnable.run();
            }
        }
        now = target;
    }

    void runDue() {
        advanceBy(0);
    }

    int pendingCount() {
        return tasks.size();
    }
}
