package com.reference.matching.ratelimit;

import com.reference.matching.metrics.MetricsService;
import com.reference.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pacing gate every outbound store request passes through.
 *
 * <p>{@link #acquire()} enforces a minimum gap between requests, doubled while the
 * limiter is in {@link PacingMode#SLOW}. {@link #record(boolean)} feeds a bounded
 * window of recent outcomes; the mode is re-evaluated on every record, SLOW iff
 * the failure fraction exceeds the circuit threshold. There is no time decay.</p>
 *
 * <p>Concurrent callers are serialized through a fair gate lock held for the whole
 * wait, so two callers can never both pass having only individually satisfied the
 * gap. The outcome window is guarded separately and never blocked by a sleeping
 * caller. An interrupted {@code acquire()} leaves the state untouched.</p>
 */
public class AdaptiveRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    private final RateLimiterConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;
    private final MetricsService metricsService;

    private final ReentrantLock gate = new ReentrantLock(true);
    private final Object windowLock = new Object();
    private final OutcomeWindow window;
    private final AtomicLong outstandingPermits = new AtomicLong();
    private final AtomicLong throttleViolations = new AtomicLong();

    private volatile PacingMode mode = PacingMode.NORMAL;
    private Instant lastRequestAt;

    public AdaptiveRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM, new Random(), new NoOpMetricsService());
    }

    public AdaptiveRateLimiter(RateLimiterConfig config, Clock clock, Sleeper sleeper, Random random,
                               MetricsService metricsService) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.window = new OutcomeWindow(config.windowSize());
        log.info("AdaptiveRateLimiter initialized: minGap={}s, threshold={}, window={}",
                config.minGapSeconds(), config.circuitThreshold(), config.windowSize());
    }

    /**
     * Blocks until the caller may issue its request.
     *
     * @throws InterruptedException if interrupted while waiting; the gap is not consumed
     */
    public void acquire() throws InterruptedException {
        gate.lockInterruptibly();
        try {
            Instant now = clock.instant();
            if (lastRequestAt != null) {
                Duration required = requiredGap();
                Duration elapsed = Duration.between(lastRequestAt, now);
                if (elapsed.compareTo(required) < 0) {
                    Duration wait = required.minus(elapsed).plus(jitter());
                    log.debug("throttle.wait wait={}ms mode={}", wait.toMillis(), mode);
                    sleeper.sleep(wait);
                    metricsService.recordThrottleWait(wait);
                    now = clock.instant();
                }
            }
            lastRequestAt = now;
            outstandingPermits.incrementAndGet();
        } finally {
            gate.unlock();
        }
    }

    /**
     * Records the outcome of a request and re-evaluates the pacing mode.
     */
    public void record(boolean success) {
        if (outstandingPermits.getAndUpdate(permits -> permits > 0 ? permits - 1 : 0) == 0) {
            throttleViolations.incrementAndGet();
            metricsService.recordThrottleViolation();
            log.warn("throttle.violation outcome recorded without a preceding acquire");
        }

        PacingMode previous;
        PacingMode next;
        double failRate;
        synchronized (windowLock) {
            window.append(success);
            failRate = window.failureRate();
            previous = mode;
            next = failRate > config.circuitThreshold() ? PacingMode.SLOW : PacingMode.NORMAL;
            mode = next;
        }

        if (previous != next) {
            metricsService.recordModeTransition(next);
            if (next == PacingMode.SLOW) {
                log.warn("throttle.slowMode.entered failRate={} threshold={} gap={}s",
                        String.format("%.2f", failRate), config.circuitThreshold(),
                        config.minGapSeconds() * config.slowMultiplier());
            } else {
                log.info("throttle.slowMode.exited failRate={} gap={}s",
                        String.format("%.2f", failRate), config.minGapSeconds());
            }
        }
    }

    /**
     * Returns a consistent snapshot of the limiter state.
     */
    public RateLimiterStats stats() {
        synchronized (windowLock) {
            boolean slow = mode == PacingMode.SLOW;
            return new RateLimiterStats(
                    config.minGapSeconds(),
                    effectiveGapSeconds(slow),
                    slow,
                    window.failureRate(),
                    window.size());
        }
    }

    public PacingMode getMode() {
        return mode;
    }

    /**
     * Returns how many outcomes were recorded without a matching acquire.
     */
    public long throttleViolations() {
        return throttleViolations.get();
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    private Duration requiredGap() {
        return seconds(effectiveGapSeconds(mode == PacingMode.SLOW));
    }

    private double effectiveGapSeconds(boolean slow) {
        return config.minGapSeconds() * (slow ? config.slowMultiplier() : 1.0);
    }

    private Duration jitter() {
        double span = config.jitterMaxSeconds() - config.jitterMinSeconds();
        return seconds(config.jitterMinSeconds() + span * random.nextDouble());
    }

    private static Duration seconds(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}
