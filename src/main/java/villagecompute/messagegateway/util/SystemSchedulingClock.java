package villagecompute.messagegateway.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/** Production clock backed by {@link Clock} and {@link CompletableFuture#delayedExecutor}. */
public final class SystemSchedulingClock implements SchedulingClock {

    private final Clock clock;

    public SystemSchedulingClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    public static SystemSchedulingClock inZone(ZoneId zone) {
        return new SystemSchedulingClock(Clock.system(zone));
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public ZoneId zone() {
        return clock.getZone();
    }

    @Override
    public CompletionStage<Void> delay(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
        }, CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));
    }
}
