package im.arun.regingest.pagination;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class PaginationResult {
    long totalCount;
    int pagesIssued;
    long recordsSeen;
    List<PageFailure> failures;

    public static PaginationResult empty() {
        return new PaginationResult(0, 0, 0, List.of());
    }

    /**
     * True when at least one page was issued and none of them succeeded.
     */
    public boolean allPagesFailed() {
        return pagesIssued > 0 && failures.size() == pagesIssued;
    }

    public PaginationResult plus(PaginationResult other) {
        List<PageFailure> combined = new ArrayList<>(failures);
        combined.addAll(other.failures);
        return new PaginationResult(totalCount + other.totalCount, pagesIssued + other.pagesIssued,
                recordsSeen + other.recordsSeen, List.copyOf(combined));
    }
}
