package im.arun.regingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.exception.PermanentHttpException;
import im.arun.regingest.exception.TransientNetworkException;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.http.FetchKey;
import im.arun.regingest.http.RateLimitedCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Calls the FCA Financial Services Register API through the shared {@link RateLimitedCache}.
 *
 * <p>Every call is best-effort: HTTP and transport failures and unexpected status codes are
 * logged and surface as an empty result, so one missing sub-resource never sinks a record.
 */
public class FcaRegisterClient {
    private static final Logger logger = LoggerFactory.getLogger(FcaRegisterClient.class);

    static final String STATUS_PREFIX = "FSR-API-";
    static final String SEARCH_OK = "FSR-API-04-01-00";
    static final String SEARCH_NO_RESULTS = "FSR-API-04-01-11";
    private static final String[] SUCCESS_MARKERS = {"Ok", "Found", "successful", "Success"};
    private static final String[] NOT_FOUND_MARKERS = {"not found", "Not Found", "No search result found"};

    private final RateLimitedCache http;
    private final String baseUrl;
    private final Map<String, String> authHeaders = new LinkedHashMap<>();

    public FcaRegisterClient(RateLimitedCache http, String baseUrl, String email, String apiKey) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (email == null || email.isEmpty() || apiKey == null || apiKey.isEmpty()) {
            logger.warn("FCA_API_EMAIL / FCA_API_KEY not set, register requests will be unauthenticated");
        }
        if (email != null && !email.isEmpty()) {
            authHeaders.put("x-auth-email", email);
        }
        if (apiKey != null && !apiKey.isEmpty()) {
            authHeaders.put("x-auth-key", apiKey);
        }
    }

    /**
     * GET {@code baseUrl + path}.
     */
    public Optional<FcaResponse> get(String path) {
        return call(request(path));
    }

    /**
     * Register search, truncated to {@code maxHits} entries. No results and failures both give
     * an empty list.
     */
    public List<JsonNode> search(String term, String type, int maxHits) {
        Optional<FcaResponse> response = call(request("/Search").withParam("q", term).withParam("type", type));
        List<JsonNode> hits = new ArrayList<>();
        if (response.isEmpty()) {
            return hits;
        }
        FcaResponse result = response.get();
        if (SEARCH_OK.equals(result.getStatus()) && result.hasData()) {
            for (JsonNode hit : result.records()) {
                if (hits.size() >= maxHits) {
                    break;
                }
                hits.add(hit);
            }
        } else if (SEARCH_NO_RESULTS.equals(result.getStatus())) {
            logger.debug("No search results for term '{}'", term);
        } else {
            logger.warn("Unexpected search response for '{}': {} - {}", term, result.getStatus(), result.getMessage());
        }
        return hits;
    }

    FetchKey request(String path) {
        return FetchKey.get(baseUrl + path).withHeaders(authHeaders);
    }

    private Optional<FcaResponse> call(FetchKey key) {
        JsonNode body;
        try {
            body = http.fetchJson(key);
        } catch (PermanentHttpException e) {
            logger.error("HTTP error {} for {}", e.getStatusCode(), key);
            return Optional.empty();
        } catch (TransientNetworkException | ValidationException e) {
            logger.warn("Failed API call to {}: {}", key, e.getMessage());
            return Optional.empty();
        }
        return interpret(key, body);
    }

    /**
     * Maps the register's status conventions: not-found messages mean no data, success messages
     * carry data, other register codes are passed through, anything else is discarded.
     */
    static Optional<FcaResponse> interpret(FetchKey key, JsonNode body) {
        String status = body.path("Status").asText("");
        String message = body.path("Message").asText("");
        JsonNode data = body.get("Data");

        // "Not Found" also contains "Found", so not-found is checked first
        if (status.startsWith(STATUS_PREFIX) && containsAny(message, NOT_FOUND_MARKERS)) {
            return Optional.of(new FcaResponse(status, message, null));
        }
        if (status.startsWith(STATUS_PREFIX) && containsAny(message, SUCCESS_MARKERS)) {
            return Optional.of(new FcaResponse(status, message, data));
        }
        if (status.startsWith(STATUS_PREFIX)) {
            logger.debug("API response for {}: {} - {}", key, status, message);
            return Optional.of(new FcaResponse(status, message, data));
        }
        logger.warn("Unexpected API response for {}: {} - {}", key, status, message);
        return Optional.empty();
    }

    private static boolean containsAny(String message, String[] markers) {
        for (String marker : markers) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
