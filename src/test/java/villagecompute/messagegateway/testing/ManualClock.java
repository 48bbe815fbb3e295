package villagecompute.messagegateway.testing;

import villagecompute.messagegateway.util.SchedulingClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Virtual-time {@link SchedulingClock} for tests.
 *
 * <p>
 * Time only moves through {@link #advance(Duration)}. Timers due within the advanced span fire in due order, with
 * {@link #now()} set to each timer's due time while its callbacks run, so timers created by callbacks fire too when
 * they fall inside the span. Zero-length delays complete immediately.
 */
public final class ManualClock implements SchedulingClock {

    private record Timer(Instant dueAt, long sequence, CompletableFuture<Void> future) {
    }

    private final ZoneId zone;
    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
            Comparator.comparing(Timer::dueAt).thenComparingLong(Timer::sequence));
    private Instant now;
    private long sequence;

    public ManualClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    public ManualClock(Instant start, ZoneId zone) {
        this.now = start;
        this.zone = zone;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    @Override
    public ZoneId zone() {
        return zone;
    }

    @Override
    public CompletionStage<Void> delay(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        synchronized (this) {
            timers.add(new Timer(now.plus(duration), sequence++, future));
        }
        return future;
    }

    /**
     * Moves time forward by {@code duration}, firing every timer that comes due on the way.
     */
    public void advance(Duration duration) {
        Instant target;
        synchronized (this) {
            target = now.plus(duration);
        }
        while (true) {
            Timer next;
            synchronized (this) {
                next = timers.peek();
                if (next == null || next.dueAt().isAfter(target)) {
                    break;
                }
                timers.poll();
                now = next.dueAt();
            }
            next.future().complete(null);
        }
        synchronized (this) {
            now = target;
        }
    }

    /**
     * Jumps to {@code instant} without firing timers. Only for setting up a scenario.
     */
    public synchronized void set(Instant instant) {
        now = instant;
    }

    public synchronized int pendingTimers() {
        return timers.size();
    }
}
