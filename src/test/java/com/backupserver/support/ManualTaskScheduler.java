package com.backupserver.support;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One-shot scheduler driven by a {@link MutableClock}: tasks run on the calling thread when
 * {@link #advance(Duration)} moves time past their due instant.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<Task> pending = new ArrayList<>();

    public ManualTaskScheduler(MutableClock clock) { this.clock = clock; }

    @Override
    public Clock getClock() { return clock; }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        Task t = new Task(task, startTime);
        pending.add(t);
        return t;
    }

    public void advance(Duration d) {
        clock.advance(d);
        runDue();
    }

    public void runDue() {
        List<Task> due;
        synchronized (this) {
            due = pending.stream()
                    .filter(t -> !t.at.isAfter(clock.instant()))
                    .sorted(Comparator.comparing(t -> t.at))
                    .toList();
            pending.removeAll(due);
        }
        for (Task t : due) {
            if (!t.cancelled) {
                t.runnable.run();
                t.done = true;
            }
        }
    }

    public synchronized int pendingCount() { return pending.size(); }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) { throw new UnsupportedOperationException(); }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) { throw new UnsupportedOperationException(); }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) { throw new UnsupportedOperationException(); }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) { throw new UnsupportedOperationException(); }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) { throw new UnsupportedOperationException(); }

    private final class Task implements ScheduledFuture<Object> {
        final Runnable runnable;
        final Instant at;
        volatile boolean cancelled;
        volatile boolean done;

        Task(Runnable runnable, Instant at) {
            this.runnable = runnable;
            this.at = at;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), at));
        }

        @Override
        public int compareTo(Delayed o) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), o.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) return false;
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() { return cancelled; }

        @Override
        public boolean isDone() { return done || cancelled; }

        @Override
        public Object get() { return null; }

        @Override
        public Object get(long timeout, TimeUnit unit) { return null; }
    }
}
