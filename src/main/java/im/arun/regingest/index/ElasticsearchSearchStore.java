package im.arun.regingest.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.regingest.exception.PermanentHttpException;
import im.arun.regingest.exception.TransientNetworkException;
import im.arun.regingest.exception.ValidationException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SearchStore} backed by the Elasticsearch REST API.
 *
 * <p>Bulk writes use {@code index} operations with the document key as {@code _id}, so writing
 * the same key twice replaces the document. Logical collection names are prefixed with the
 * configured index prefix.
 */
public class ElasticsearchSearchStore implements SearchStore {
    private static final Logger logger = LoggerFactory.getLogger(ElasticsearchSearchStore.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType NDJSON = MediaType.get("application/x-ndjson");

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final String indexPrefix;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ElasticsearchSearchStore(OkHttpClient httpClient, String baseUrl, String apiKey, String indexPrefix) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Elasticsearch URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.apiKey = apiKey;
        this.indexPrefix = indexPrefix == null ? "" : indexPrefix;
    }

    public String indexName(String collection) {
        return indexPrefix + collection;
    }

    @Override
    public BulkResult bulkUpsert(String collection, List<IndexAction> actions) {
        if (actions.isEmpty()) {
            return BulkResult.allAccepted(0);
        }
        String index = indexName(collection);
        StringBuilder body = new StringBuilder();
        try {
            for (IndexAction action : actions) {
                ObjectNode meta = objectMapper.createObjectNode();
                meta.putObject("index").put("_index", index).put("_id", action.getDocumentKey());
                body.append(objectMapper.writeValueAsString(meta)).append('\n');
                body.append(objectMapper.writeValueAsString(action.getDocument())).append('\n');
            }
        } catch (IOException e) {
            throw new ValidationException("Cannot serialize bulk request for " + index, e);
        }

        JsonNode response = execute(newRequest(url("_bulk"))
                .post(RequestBody.create(body.toString(), NDJSON)).build());

        int accepted = 0;
        Map<String, BulkItemError> errors = new LinkedHashMap<>();
        for (JsonNode item : response.path("items")) {
            JsonNode result = item.path("index");
            String id = result.path("_id").asText();
            int status = result.path("status").asInt(500);
            if (status >= 200 && status < 300) {
                accepted++;
            } else {
                JsonNode error = result.path("error");
                String reason = error.isObject()
                        ? error.path("type").asText() + ": " + error.path("reason").asText()
                        : error.asText("HTTP " + status);
                errors.put(id, new BulkItemError(status, reason));
            }
        }
        logger.debug("Bulk upsert into {}: {} accepted, {} rejected", index, accepted, errors.size());
        return new BulkResult(accepted, errors);
    }

    @Override
    public List<SearchHit> search(String collection, SearchQuery query) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("size", query.getSize());
        ObjectNode bool = body.putObject("query").putObject("bool");
        if (query.getText() == null || query.getText().isBlank()) {
            bool.putArray("must").addObject().putObject("match_all");
        } else {
            ObjectNode multiMatch = bool.putArray("must").addObject().putObject("multi_match");
            multiMatch.put("query", query.getText());
            multiMatch.putArray("fields").add("*");
        }
        ArrayNode filter = bool.putArray("filter");
        query.getFilters().forEach((field, value) -> filter.addObject().putObject("term").put(field, value));

        JsonNode response = execute(newRequest(url(indexName(collection), "_search"))
                .post(RequestBody.create(body.toString(), JSON)).build());

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            hits.add(new SearchHit(hit.path("_id").asText(), hit.path("_score").asDouble(0), hit.path("_source")));
        }
        return hits;
    }

    @Override
    public void createCollection(String collection) {
        String index = indexName(collection);
        try {
            execute(newRequest(url(index)).put(RequestBody.create("{}", JSON)).build());
            logger.info("Created index {}", index);
        } catch (PermanentHttpException e) {
            if (e.getStatusCode() != 400) {
                throw e;
            }
            // resource_already_exists_exception
            logger.info("Index {} already exists", index);
        }
    }

    @Override
    public void deleteCollection(String collection) {
        String index = indexName(collection);
        try {
            execute(newRequest(url(index)).delete().build());
            logger.info("Deleted index {}", index);
        } catch (PermanentHttpException e) {
            if (e.getStatusCode() != 404) {
                throw e;
            }
            logger.info("Index {} does not exist", index);
        }
    }

    @Override
    public long count(String collection) {
        JsonNode response = execute(newRequest(url(indexName(collection), "_count")).get().build());
        return response.path("count").asLong();
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private Request.Builder newRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.header("Authorization", "ApiKey " + apiKey);
        }
        return builder;
    }

    private JsonNode execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            int status = response.code();
            if (status == 429 || status >= 500) {
                throw new TransientNetworkException("Elasticsearch returned HTTP " + status + " for "
                        + request.method() + " " + request.url().encodedPath());
            }
            if (status >= 400) {
                logger.debug("Elasticsearch error body: {}", text);
                throw new PermanentHttpException(status, request.url().toString());
            }
            return text.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            throw new TransientNetworkException("Elasticsearch request failed: " + request.method() + " "
                    + request.url().encodedPath(), e);
        }
    }
}
