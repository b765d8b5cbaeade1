package im.arun.regingest.pagination;

import im.arun.regingest.http.FetchKey;
import lombok.Getter;

import java.util.Map;

/**
 * A paginated upstream query: the base request, the field carrying the total count, and the
 * names of the offset/limit parameters.
 */
@Getter
public class PagedEndpoint {
    public static final String DEFAULT_OFFSET_PARAM = "skip";
    public static final String DEFAULT_LIMIT_PARAM = "take";

    private final String name;
    private final FetchKey baseKey;
    private final String countField;
    private final String offsetParam;
    private final String limitParam;

    public PagedEndpoint(String name, FetchKey baseKey, String countField) {
        this(name, baseKey, countField, DEFAULT_OFFSET_PARAM, DEFAULT_LIMIT_PARAM);
    }

    public PagedEndpoint(String name, FetchKey baseKey, String countField, String offsetParam, String limitParam) {
        this.name = name;
        this.baseKey = baseKey;
        this.countField = countField;
        this.offsetParam = offsetParam;
        this.limitParam = limitParam;
    }

    public static PagedEndpoint of(String name, String url, Map<String, ?> params, String countField) {
        return new PagedEndpoint(name, FetchKey.get(url).withParams(params), countField);
    }

    public FetchKey countRequest() {
        return baseKey.withParam(limitParam, 1).withParam(offsetParam, 0);
    }

    public FetchKey pageRequest(Page page) {
        return baseKey.withParam(limitParam, page.getPageSize()).withParam(offsetParam, page.getOffset());
    }

    @Override
    public String toString() {
        return name;
    }
}
