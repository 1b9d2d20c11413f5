package com.questrail.mcumgr.time;

import com.questrail.mcumgr.internal.time.Cancellable;
import com.questrail.mcumgr.internal.time.MonotonicClock;
import com.questrail.mcumgr.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler for request-timeout tests. Nothing fires on its own: tests advance
 * a {@link ManualMonotonicClock} and then call {@link #runDueTasks()}.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Timer> timers = new PriorityQueue<>();
    private long order;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Timer timer = new Timer(deadlineNanos, order++, task);
        timers.add(timer);
        return timer;
    }

    /**
     * Fires every live timer whose deadline has passed, earliest first.
     *
     * @return number of timers fired
     */
    public int runDueTasks() {
        int fired = 0;
        while (true) {
            Timer next;
            synchronized (this) {
                if (timers.isEmpty() || timers.peek().deadlineNanos > clock.nowNanos()) {
                    return fired;
                }
                next = timers.poll();
            }
            if (next.fired.compareAndSet(false, true)) {
                next.task.run();
                fired++;
            }
        }
    }

    public synchronized int liveTimerCount() {
        return (int) timers.stream().filter(t -> !t.fired.get()).count();
    }

    private static final class Timer implements Comparable<Timer>, Cancellable {
        private final long deadlineNanos;
        private final long order;
        private final Runnable task;
        // Set on cancel as well, so a timer runs or is cancelled, never both.
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Timer(long deadlineNanos, long order, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.order = order;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return fired.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Timer o) {
            int byDeadline = Long.compare(deadlineNanos, o.deadlineNanos);
            return (byDeadline != 0) ? byDeadline : Long.compare(order, o.order);
        }
    }
}
