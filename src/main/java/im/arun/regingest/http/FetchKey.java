package im.arun.regingest.http;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import okhttp3.HttpUrl;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identifies a cacheable upstream request: method, URL, query parameters and the subset of
 * headers that changes the response (authentication headers included).
 * Immutable; the {@code with*} methods return copies.
 */
@Getter
@EqualsAndHashCode
public final class FetchKey {
    private final String method;
    private final String url;
    private final Map<String, String> params;
    private final Map<String, String> headers;

    private FetchKey(String method, String url, Map<String, String> params, Map<String, String> headers) {
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static FetchKey get(String url) {
        return new FetchKey("GET", url, Map.of(), Map.of());
    }

    public FetchKey withParam(String name, Object value) {
        Map<String, String> copy = new LinkedHashMap<>(params);
        copy.put(name, String.valueOf(value));
        return new FetchKey(method, url, copy, headers);
    }

    public FetchKey withParams(Map<String, ?> extra) {
        Map<String, String> copy = new LinkedHashMap<>(params);
        extra.forEach((k, v) -> copy.put(k, String.valueOf(v)));
        return new FetchKey(method, url, copy, headers);
    }

    public FetchKey withHeaders(Map<String, String> extra) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.putAll(extra);
        return new FetchKey(method, url, params, copy);
    }

    /**
     * Full request URL including the query string.
     */
    public HttpUrl toHttpUrl() {
        HttpUrl base = HttpUrl.parse(url);
        if (base == null) {
            throw new IllegalArgumentException("Not a valid http(s) URL: " + url);
        }
        HttpUrl.Builder builder = base.newBuilder();
        params.forEach(builder::addQueryParameter);
        return builder.build();
    }

    /**
     * Order-independent SHA-256 of the request identity. Used as the on-disk cache file name.
     */
    public String cacheId() {
        return sha256Hex(canonical());
    }

    String canonical() {
        return render(false);
    }

    /**
     * Canonical form with every header value replaced by its SHA-256. This is the form written
     * to disk next to a cached response.
     */
    String persistedForm() {
        return render(true);
    }

    private String render(boolean hashHeaderValues) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(' ').append(url).append('\n');
        new TreeMap<>(params).forEach((k, v) -> sb.append("p:").append(k).append('=').append(v).append('\n'));
        Map<String, String> sortedHeaders = new TreeMap<>();
        headers.forEach((k, v) -> sortedHeaders.put(k.toLowerCase(Locale.ROOT), v));
        sortedHeaders.forEach((k, v) -> sb.append("h:").append(k).append('=')
                .append(hashHeaderValues ? sha256Hex(v) : v).append('\n'));
        return sb.toString();
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        // headers omitted: they may carry credentials
        return method + " " + url + (params.isEmpty() ? "" : " " + params);
    }
}
