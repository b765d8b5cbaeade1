package im.arun.regingest.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.exception.PermanentHttpException;
import im.arun.regingest.exception.TransientNetworkException;
import im.arun.regingest.exception.ValidationException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single HTTP fetch primitive of the engine: response cache in front of a global rate
 * limiter in front of the network, with transport-level retries.
 *
 * <p>The cache is consulted before a token is taken, so re-running a job over already fetched
 * pages costs no rate budget. Only 2xx responses are cached. 4xx responses fail with
 * {@link PermanentHttpException} and are never retried; 5xx responses and exhausted transport
 * retries fail with {@link TransientNetworkException}.
 *
 * <p>Constructed once per process and shared by every loader.
 */
public class RateLimitedCache {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitedCache.class);
    private static final long MAX_BACKOFF_MS = 30000;

    private final OkHttpClient httpClient;
    private final DiskResponseCache cache;
    private final TokenBucketRateLimiter rateLimiter;
    private final int maxRetries;
    private final Duration rateLimitMaxWait;
    private final long baseBackoffMs;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong networkCalls = new AtomicLong();

    public RateLimitedCache(OkHttpClient httpClient,
                            DiskResponseCache cache,
                            TokenBucketRateLimiter rateLimiter,
                            int maxRetries,
                            Duration rateLimitMaxWait,
                            long baseBackoffMs) {
        this(httpClient, cache, rateLimiter, maxRetries, rateLimitMaxWait, baseBackoffMs, Clock.systemUTC());
    }

    public RateLimitedCache(OkHttpClient httpClient,
                            DiskResponseCache cache,
                            TokenBucketRateLimiter rateLimiter,
                            int maxRetries,
                            Duration rateLimitMaxWait,
                            long baseBackoffMs,
                            Clock clock) {
        this.httpClient = httpClient;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.maxRetries = Math.max(0, maxRetries);
        this.rateLimitMaxWait = rateLimitMaxWait;
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        this.clock = clock;
    }

    /**
     * Fetches a response, from the cache when a fresh entry exists.
     */
    public FetchResponse fetch(FetchKey key) {
        Optional<FetchResponse> cached = cache.get(key);
        if (cached.isPresent()) {
            logger.debug("Cache hit: {}", key);
            return cached.get();
        }

        Request request = buildRequest(key);
        IOException lastFailure = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            rateLimiter.acquire(rateLimitMaxWait);
            networkCalls.incrementAndGet();
            try (Response response = httpClient.newCall(request).execute()) {
                return handle(key, response);
            } catch (IOException e) {
                lastFailure = e;
                logger.warn("Request {} failed (attempt {}/{}): {}", key, attempt + 1, maxRetries + 1, e.toString());
                if (attempt < maxRetries) {
                    backoff(attempt);
                }
            }
        }
        throw new TransientNetworkException("Request " + key + " failed after " + (maxRetries + 1) + " attempts",
                lastFailure);
    }

    /**
     * Fetches and parses a JSON body.
     *
     * @throws ValidationException if the body is not JSON
     */
    public JsonNode fetchJson(FetchKey key) {
        FetchResponse response = fetch(key);
        try {
            return objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new ValidationException("Response from " + key + " is not valid JSON", e);
        }
    }

    /**
     * Number of requests actually sent over the network (retries included).
     */
    public long networkCallCount() {
        return networkCalls.get();
    }

    public TokenBucketRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public DiskResponseCache getCache() {
        return cache;
    }

    private FetchResponse handle(FetchKey key, Response response) throws IOException {
        int status = response.code();
        ResponseBody body = response.body();
        String text = body != null ? body.string() : "";
        if (status >= 200 && status < 300) {
            String contentType = body != null && body.contentType() != null ? body.contentType().toString() : null;
            FetchResponse result = new FetchResponse(status, text, contentType, clock.millis());
            cache.put(key, result);
            return result;
        }
        if (status >= 400 && status < 500) {
            throw new PermanentHttpException(status, key.getUrl());
        }
        throw new TransientNetworkException("HTTP " + status + " for " + key);
    }

    private Request buildRequest(FetchKey key) {
        Request.Builder builder = new Request.Builder()
                .url(key.toHttpUrl())
                .method(key.getMethod(), null);
        key.getHeaders().forEach(builder::header);
        return builder.build();
    }

    private void backoff(int attempt) {
        long delay = Math.min(baseBackoffMs * (1L << attempt), MAX_BACKOFF_MS);
        if (delay == 0) {
            return;
        }
        logger.debug("Retrying in {}ms", delay);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry wait");
        }
    }
}
