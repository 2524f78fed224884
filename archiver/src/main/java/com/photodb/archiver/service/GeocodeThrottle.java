package com.photodb.archiver.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide gate in front of every reverse-geocode request.
 *
 * The Resilience4j limiter counts permits per fixed refresh cycle, so a call at
 * the end of one cycle and a call at the start of the next can be almost
 * simultaneous. This gate additionally keeps consecutive grants at least one
 * refresh period apart, measured from the previous grant. Period and wait
 * timeout are the limiter's own settings (resilience4j.ratelimiter.instances.geocoder).
 *
 * Callers block while waiting. A caller that cannot be served within the
 * timeout gets {@link RequestNotPermitted}.
 */
@Slf4j
public class GeocodeThrottle {

    private final RateLimiter rateLimiter;
    private final long spacingNanos;
    private final long timeoutNanos;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long nextGrantNanos;
    private boolean granted;

    public GeocodeThrottle(RateLimiter rateLimiter) {
        RateLimiterConfig config = rateLimiter.getRateLimiterConfig();
        this.rateLimiter = rateLimiter;
        this.spacingNanos = config.getLimitRefreshPeriod().toNanos();
        this.timeoutNanos = config.getTimeoutDuration().toNanos();
    }

    /**
     * Block until the next request may go out.
     *
     * @return the {@link System#nanoTime()} at which the permit was granted
     * @throws RequestNotPermitted if no permit was available within the timeout,
     *                             or the waiting thread was interrupted
     */
    public long acquire() {
        long deadline = System.nanoTime() + timeoutNanos;
        try {
            if (!lock.tryLock(timeoutNanos, TimeUnit.NANOSECONDS)) {
                throw RequestNotPermitted.createRequestNotPermitted(rateLimiter);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RequestNotPermitted.createRequestNotPermitted(rateLimiter);
        }
        try {
            waitForSpacing(deadline);
            RateLimiter.waitForPermission(rateLimiter);
            long now = System.nanoTime();
            nextGrantNanos = now + spacingNanos;
            granted = true;
            return now;
        } finally {
            lock.unlock();
        }
    }

    public Duration getSpacing() {
        return Duration.ofNanos(spacingNanos);
    }

    private void waitForSpacing(long deadline) {
        if (!granted) {
            return;
        }
        if (nextGrantNanos - deadline > 0) {
            log.debug("Geocode permit would exceed the wait timeout");
            throw RequestNotPermitted.createRequestNotPermitted(rateLimiter);
        }
        long remaining;
        while ((remaining = nextGrantNanos - System.nanoTime()) > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw RequestNotPermitted.createRequestNotPermitted(rateLimiter);
            }
        }
    }
}
