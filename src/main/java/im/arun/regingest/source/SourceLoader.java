package im.arun.regingest.source;

/**
 * Loads one source into its collection.
 */
public interface SourceLoader {

    Source source();

    /**
     * Runs a full load from the count phase onwards. Page and record failures are contained
     * and reported; a failed count or a run where every page failed throws.
     */
    LoadReport load(DateRange range);
}
