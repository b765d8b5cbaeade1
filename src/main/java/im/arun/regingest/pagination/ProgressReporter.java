package im.arun.regingest.pagination;

/**
 * Per-page progress callbacks. Implementations must be thread-safe.
 */
public interface ProgressReporter {

    void start(String task, long total);

    void advance(String task, long records);

    void finish(String task);

    ProgressReporter NONE = new ProgressReporter() {
        @Override
        public void start(String task, long total) {
        }

        @Override
        public void advance(String task, long records) {
        }

        @Override
        public void finish(String task) {
        }
    };
}
