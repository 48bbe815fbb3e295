package villagecompute.messagegateway.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.util.SchedulingClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Clock-driven rate limiting with Caffeine-backed buckets.
 *
 * <p>
 * Two independent mechanisms:
 * <ul>
 * <li><b>Spacing:</b> a minimum interval between successive marks on a key. {@link #awaitSpacing} returns a stage that
 * completes once the interval since the previous mark has passed, then records a new mark. Nothing blocks.</li>
 * <li><b>Volume:</b> sliding-window caps. {@link #recordVolume} adds weighted hits; {@link #checkVolume} reports how much
 * of a {@link RateLimitRule} is left in the window ending now. A hit leaves the window exactly {@code window} after it
 * was recorded.</li>
 * </ul>
 *
 * <p>
 * All times come from the injected {@link SchedulingClock}, so windows and spacing follow virtual time in tests. Buckets
 * are evicted after a day without access.
 *
 * <p>
 * <b>Thread Safety:</b> Buckets are synchronized individually; caches are thread-safe.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    @Inject
    SchedulingClock clock;

    /**
     * Sliding window buckets (key -> weighted hits, oldest first).
     */
    private final Cache<String, Deque<Hit>> volumeBuckets = Caffeine.newBuilder().expireAfterAccess(25, TimeUnit.HOURS)
            .maximumSize(10_000).build();

    /**
     * Last spacing mark per key.
     */
    private final Cache<String, Instant> spacingMarks = Caffeine.newBuilder().expireAfterAccess(24, TimeUnit.HOURS)
            .maximumSize(10_000).build();

    /**
     * Volume check result.
     *
     * @param allowed
     *            at least one more unit fits in the window
     * @param limit
     *            rule maximum
     * @param remaining
     *            units that still fit
     * @param resetsAt
     *            when the oldest counted hit leaves the window, null if the window is empty
     */
    public record RateLimitResult(boolean allowed, int limit, int remaining, Instant resetsAt) {
    }

    /**
     * Reports the capacity left under {@code rule} for {@code key}. Does not record anything.
     */
    public RateLimitResult checkVolume(String key, RateLimitRule rule) {
        Objects.requireNonNull(key, "Rate limit key is required");
        Objects.requireNonNull(rule, "RateLimitRule is required");

        Instant now = clock.now();
        Deque<Hit> hits = volumeBuckets.get(key, k -> new ArrayDeque<>());

        synchronized (hits) {
            pruneWindow(hits, now, rule.window());
            int used = hits.stream().mapToInt(Hit::weight).sum();
            int remaining = Math.max(0, rule.maxRequests() - used);
            Instant resetsAt = hits.isEmpty() ? null : hits.peekFirst().at().plus(rule.window());
            if (remaining == 0) {
                LOG.debugf("Volume cap reached: rule=%s bucket=%s max=%d resets=%s", rule.name(), key,
                        rule.maxRequests(), resetsAt);
            }
            return new RateLimitResult(remaining > 0, rule.maxRequests(), remaining, resetsAt);
        }
    }

    /**
     * Records {@code units} hits on {@code key} at the current time.
     */
    public void recordVolume(String key, int units) {
        if (units <= 0) {
            return;
        }
        Deque<Hit> hits = volumeBuckets.get(key, k -> new ArrayDeque<>());
        synchronized (hits) {
            hits.addLast(new Hit(clock.now(), units));
        }
    }

    /**
     * Units counted on {@code key} within {@code window} of now.
     */
    public int usage(String key, Duration window) {
        Deque<Hit> hits = volumeBuckets.getIfPresent(key);
        if (hits == null) {
            return 0;
        }
        synchronized (hits) {
            pruneWindow(hits, clock.now(), window);
            return hits.stream().mapToInt(Hit::weight).sum();
        }
    }

    /**
     * Records a spacing mark at the current time without waiting.
     */
    public void markSpacing(String key) {
        spacingMarks.put(key, clock.now());
    }

    /**
     * Waits until {@code spacing} has elapsed since the previous mark on {@code key}, then marks again. Completes
     * immediately when the key has no mark or the spacing already passed.
     */
    public CompletionStage<Void> awaitSpacing(String key, Duration spacing) {
        Instant now = clock.now();
        Instant last = spacingMarks.getIfPresent(key);
        Duration wait = last == null ? Duration.ZERO : Duration.between(now, last.plus(spacing));
        if (wait.isNegative()) {
            wait = Duration.ZERO;
        }
        if (!wait.isZero()) {
            LOG.tracef("Spacing %s: waiting %d ms", key, wait.toMillis());
        }
        return clock.delay(wait).thenRun(() -> markSpacing(key));
    }

    /**
     * Forgets the spacing mark and volume bucket of {@code key}.
     */
    public void release(String key) {
        spacingMarks.invalidate(key);
        volumeBuckets.invalidate(key);
    }

    private void pruneWindow(Deque<Hit> hits, Instant now, Duration window) {
        while (!hits.isEmpty() && Duration.between(hits.peekFirst().at(), now).compareTo(window) >= 0) {
            hits.removeFirst();
        }
    }

    private record Hit(Instant at, int weight) {
    }

    public record RateLimitRule(String name, int maxRequests, Duration window) {

        public RateLimitRule {
            if (maxRequests <= 0) {
                throw new IllegalArgumentException("maxRequests must be positive");
            }
            if (window == null || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("window must be positive");
            }
        }

        public static RateLimitRule of(String name, int maxRequests, Duration window) {
            return new RateLimitRule(name, maxRequests, window);
        }
    }
}
