package im.arun.regingest.http;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds the single {@link OkHttpClient} shared by every upstream call.
 */
public final class HttpClientFactory {
    public static final String USER_AGENT = "registry-ingest";

    private HttpClientFactory() {}

    public static OkHttpClient create(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .retryOnConnectionFailure(false)
                .connectionPool(new ConnectionPool(32, 5, TimeUnit.MINUTES))
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("User-Agent", USER_AGENT)
                        .build()))
                .build();
    }
}
