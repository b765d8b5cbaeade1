package im.arun.regingest.http;

import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Application interceptor standing in for the upstream APIs. Routes are matched in registration
 * order; unmatched requests get a 404. Every request is recorded.
 */
public class FakeUpstream implements Interceptor {
    private static final MediaType JSON = MediaType.get("application/json");

    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public FakeUpstream json(Predicate<HttpUrl> matcher, Function<HttpUrl, String> body) {
        routes.add(new Route(matcher, url -> new Reply(200, body.apply(url), null), -1));
        return this;
    }

    public FakeUpstream json(String pathSuffix, String body) {
        return json(url -> url.encodedPath().endsWith(pathSuffix), url -> body);
    }

    public FakeUpstream status(Predicate<HttpUrl> matcher, int status) {
        routes.add(new Route(matcher, url -> new Reply(status, "{\"error\":\"" + status + "\"}", null), -1));
        return this;
    }

    /**
     * Fails the first {@code times} matching requests at the transport level.
     */
    public FakeUpstream failTransport(Predicate<HttpUrl> matcher, int times) {
        routes.add(new Route(matcher, url -> new Reply(0, null, new IOException("connection reset")), times));
        return this;
    }

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    /**
     * A fetch primitive over this fake with a generous rate limit and no retry backoff.
     */
    public RateLimitedCache rateLimitedCache(Path cacheDir) {
        return new RateLimitedCache(client(), new DiskResponseCache(cacheDir),
                new TokenBucketRateLimiter(Duration.ofMillis(1), 1000), 2, Duration.ofSeconds(5), 0);
    }

    public int callCount() {
        return requests.size();
    }

    public int callCount(Predicate<HttpUrl> matcher) {
        int count = 0;
        for (Request request : requests) {
            if (matcher.test(request.url())) {
                count++;
            }
        }
        return count;
    }

    public List<Request> requests() {
        return new ArrayList<>(requests);
    }

    public static Predicate<HttpUrl> path(String suffix) {
        return url -> url.encodedPath().endsWith(suffix);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);
        for (Route route : routes) {
            if (!route.matcher.test(request.url()) || !route.claim()) {
                continue;
            }
            Reply reply = route.reply.apply(request.url());
            if (reply.failure != null) {
                throw reply.failure;
            }
            return response(request, reply.status, reply.body);
        }
        return response(request, 404, "{\"error\":\"not found\"}");
    }

    private static Response response(Request request, int status, String body) {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(status)
                .message(status == 200 ? "OK" : "HTTP " + status)
                .body(ResponseBody.create(body, JSON))
                .build();
    }

    private static final class Route {
        private final Predicate<HttpUrl> matcher;
        private final Function<HttpUrl, Reply> reply;
        private final AtomicInteger remaining;

        private Route(Predicate<HttpUrl> matcher, Function<HttpUrl, Reply> reply, int times) {
            this.matcher = matcher;
            this.reply = reply;
            this.remaining = times < 0 ? null : new AtomicInteger(times);
        }

        private boolean claim() {
            return remaining == null || remaining.getAndDecrement() > 0;
        }
    }

    private static final class Reply {
        private final int status;
        private final String body;
        private final IOException failure;

        private Reply(int status, String body, IOException failure) {
            this.status = status;
            this.body = body;
            this.failure = failure;
        }
    }
}
