package im.arun.regingest.pagination;

import lombok.Value;

/**
 * A page that produced no records because fetching, parsing or sinking it failed.
 */
@Value
public class PageFailure {
    String endpoint;
    Page page;
    String errorType;
    String message;

    static PageFailure of(PagedEndpoint endpoint, Page page, Throwable error) {
        return new PageFailure(endpoint.getName(), page, error.getClass().getSimpleName(), error.getMessage());
    }
}
