package com.arrowcontrol.target.support;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs scheduled tasks on the calling thread when time is advanced.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final List<ManualTask> tasks = new ArrayList<>();
    private Instant now = Instant.parse("2024-05-01T10:00:00Z");

    @Override
    public Clock getClock() {
        return new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now;
            }
        };
    }

    public void advance(Duration duration) {
        Instant target = now.plus(duration);
        Optional<ManualTask> next;
        while ((next = nextDue(target)).isPresent()) {
            ManualTask task = next.get();
            now = task.due;
            if (task.period == null) {
                task.done = true;
            } else {
                task.due = task.due.plus(task.period);
            }
            task.runnable.run();
        }
        now = target;
    }

    public void runDue() {
        advance(Duration.ZERO);
    }

    public long pendingOneShots() {
        return tasks.stream().filter(task -> task.period == null && task.isPending()).count();
    }

    public long activePeriodic() {
        return tasks.stream().filter(task -> task.period != null && task.isPending()).count();
    }

    private Optional<ManualTask> nextDue(Instant target) {
        return tasks.stream()
                .filter(ManualTask::isPending)
                .filter(task -> !task.due.isAfter(target))
                .min(Comparator.comparing(task -> task.due));
    }

    private ManualTask add(Runnable runnable, Instant due, Duration period) {
        ManualTask task = new ManualTask(runnable, due, period);
        tasks.add(task);
        return task;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Trigger scheduling is not used");
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        return add(task, startTime, null);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        return add(task, startTime, period);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        return add(task, now, period);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        return add(task, startTime, delay);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        return add(task, now, delay);
    }

    private final class ManualTask implements ScheduledFuture<Object> {

        private final Runnable runnable;
        private final Duration period;
        private Instant due;
        private boolean cancelled;
        private boolean done;

        private ManualTask(Runnable runnable, Instant due, Duration period) {
            this.runnable = runnable;
            this.due = due;
            this.period = period;
        }

        private boolean isPending() {
            return !cancelled && !done;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(now, due));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
