package im.arun.regingest.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Turns one page body into records. Invalid entries are filtered out; a body that cannot be
 * read at all is rejected with {@link im.arun.regingest.exception.ValidationException}.
 */
@FunctionalInterface
public interface PageParser<R> {
    List<R> parse(JsonNode body);
}
