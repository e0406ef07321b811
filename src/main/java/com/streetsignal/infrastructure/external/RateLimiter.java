package com.streetsignal.infrastructure.external;

import com.streetsignal.domain.exception.ExternalServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Single-token bucket: at most one request per {@code minInterval} for one
 * external service. Callers block until the token refills and are served in
 * arrival order (fair lock), nothing is dropped.
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    /**
     * Pause hook, replaced in tests.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final String service;
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long nextPermitAt;
    private boolean used;

    public RateLimiter(String service, Duration minInterval) {
        this(service, minInterval, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    RateLimiter(String service, Duration minInterval, LongSupplier nanoClock, Sleeper sleeper) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("Rate limit interval must not be negative");
        }
        this.service = service;
        this.intervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws ExternalServiceException if interrupted while waiting
     */
    public void acquire() {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            if (used && now < nextPermitAt) {
                long waitNanos = nextPermitAt - now;
                logger.debug("Rate limit for {}: waiting {} ms", service, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                sleeper.sleep(waitNanos);
                now = nextPermitAt;
            }
            nextPermitAt = now + intervalNanos;
            used = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} rate limit", service);
            throw new ExternalServiceException(service, "Interrupted while waiting for rate limit", 0, null, e);
        } finally {
            lock.unlock();
        }
    }

    public String getService() {
        return service;
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}
