package im.arun.regingest.source;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Loadable sources, by CLI name, with the collection each one writes to.
 */
public enum Source {
    HANSARD("hansard", "hansard_contributions", true),
    PARLIAMENTARY_QUESTIONS("parliamentary-questions", "parliamentary_questions", true),
    FIRMS_REGISTER("firms-register", "authorised_firms", false),
    INDIVIDUALS("individuals", "individuals", false),
    PRODUCTS("products", "products", false);

    private final String cliName;
    private final String collection;
    private final boolean dateBound;

    Source(String cliName, String collection, boolean dateBound) {
        this.cliName = cliName;
        this.collection = collection;
        this.dateBound = dateBound;
    }

    public String getCliName() {
        return cliName;
    }

    public String getCollection() {
        return collection;
    }

    /**
     * Whether loads of this source need a from-date.
     */
    public boolean isDateBound() {
        return dateBound;
    }

    public static Source fromCliName(String name) {
        for (Source source : values()) {
            if (source.cliName.equals(name)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + name + ". Supported sources: " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(Source::getCliName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return cliName;
    }
}
