package im.arun.regingest.pagination;

import java.util.List;

/**
 * Receives the valid records of each page as soon as the page is parsed.
 * Called concurrently from page tasks.
 */
@FunctionalInterface
public interface PageSink<R> {
    void accept(Page page, List<R> records);
}
