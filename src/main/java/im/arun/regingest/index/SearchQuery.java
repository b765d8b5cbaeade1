package im.arun.regingest.index;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free text matched against every field, narrowed by exact-value filters.
 */
@Value
public class SearchQuery {
    public static final int DEFAULT_SIZE = 10;

    String text;
    Map<String, String> filters;
    int size;

    public static SearchQuery text(String text) {
        return new SearchQuery(text, Map.of(), DEFAULT_SIZE);
    }

    public SearchQuery withFilter(String field, String value) {
        Map<String, String> copy = new LinkedHashMap<>(filters);
        copy.put(field, value);
        return new SearchQuery(text, copy, size);
    }

    public SearchQuery withSize(int newSize) {
        return new SearchQuery(text, filters, newSize);
    }
}
