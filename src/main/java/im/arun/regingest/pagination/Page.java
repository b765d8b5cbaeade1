package im.arun.regingest.pagination;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One slice of a paginated result set.
 */
@Value
public class Page {
    long offset;
    int pageSize;

    /**
     * Pages with offsets {@code 0, pageSize, 2*pageSize, ...} below {@code total}.
     * Ranges never overlap.
     */
    public static List<Page> partition(long total, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1");
        }
        if (total <= 0) {
            return Collections.emptyList();
        }
        List<Page> pages = new ArrayList<>();
        for (long offset = 0; offset < total; offset += pageSize) {
            pages.add(new Page(offset, pageSize));
        }
        return pages;
    }

    @Override
    public String toString() {
        return "Page[offset=" + offset + ", size=" + pageSize + "]";
    }
}
