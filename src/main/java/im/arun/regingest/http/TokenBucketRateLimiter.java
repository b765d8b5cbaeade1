package im.arun.regingest.http;

import im.arun.regingest.exception.RateLimitTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Process-wide token bucket. Refills one token every {@code refillInterval} up to {@code capacity}.
 *
 * <p>Callers reserve a slot under the lock and sleep outside it, so waiting callers are served
 * in reservation order and never hold the monitor while sleeping.
 */
public class TokenBucketRateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final long refillIntervalNanos;
    private final int capacity;
    private final LongSupplier nanoClock;
    private final AtomicLong granted = new AtomicLong();

    private double storedTokens;
    private long nextFreeNanos;

    public TokenBucketRateLimiter(Duration refillInterval, int capacity) {
        this(refillInterval, capacity, System::nanoTime);
    }

    TokenBucketRateLimiter(Duration refillInterval, int capacity, LongSupplier nanoClock) {
        if (refillInterval.isNegative() || refillInterval.isZero()) {
            throw new IllegalArgumentException("refillInterval must be positive");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.refillIntervalNanos = refillInterval.toNanos();
        this.capacity = capacity;
        this.nanoClock = nanoClock;
        this.storedTokens = capacity;
        this.nextFreeNanos = nanoClock.getAsLong();
    }

    /**
     * Blocks until a token is granted.
     *
     * @throws RateLimitTimeoutException if no token can be granted within {@code maxWait}
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public void acquire(Duration maxWait) {
        long waitNanos = reserve(maxWait.toNanos());
        if (waitNanos < 0) {
            throw new RateLimitTimeoutException(maxWait);
        }
        if (waitNanos > 0) {
            logger.trace("Rate limiting: waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for a rate-limit token");
            }
        }
        granted.incrementAndGet();
    }

    /**
     * Number of tokens handed out so far.
     */
    public long grantedCount() {
        return granted.get();
    }

    /**
     * Reserves the next token and returns how long the caller must wait for it,
     * or -1 when that wait would exceed {@code maxWaitNanos} (nothing is reserved then).
     */
    synchronized long reserve(long maxWaitNanos) {
        long now = nanoClock.getAsLong();
        if (now > nextFreeNanos) {
            storedTokens = Math.min(capacity, storedTokens + (double) (now - nextFreeNanos) / refillIntervalNanos);
            nextFreeNanos = now;
        }
        double fromStore = Math.min(1.0, storedTokens);
        long availableAt = nextFreeNanos + (long) ((1.0 - fromStore) * refillIntervalNanos);
        long waitNanos = Math.max(0L, availableAt - now);
        if (waitNanos > maxWaitNanos) {
            return -1;
        }
        storedTokens -= fromStore;
        nextFreeNanos = availableAt;
        return waitNanos;
    }
}
