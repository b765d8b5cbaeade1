package im.arun.regingest.exception;

import java.time.Duration;

/**
 * The rate limiter could not grant a slot within the bounded wait. Treated as transient.
 */
public class RateLimitTimeoutException extends TransientNetworkException {
    public RateLimitTimeoutException(Duration waited) {
        super(ErrorCode.RATE_LIMIT_TIMEOUT, "No rate-limit token granted within " + waited);
    }
}
