package im.arun.regingest.hierarchy;

import java.util.Locale;

/**
 * House of Parliament, as named by the Hansard API.
 */
public enum Chamber {
    COMMONS("Commons"),
    LORDS("Lords");

    private final String apiName;

    Chamber(String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }

    /**
     * Parses the {@code House} value carried by Hansard records.
     *
     * @throws IllegalArgumentException for anything other than Commons or Lords
     */
    public static Chamber fromApiName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Chamber chamber : values()) {
                if (chamber.apiName.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return chamber;
                }
            }
        }
        throw new IllegalArgumentException("Unknown chamber: " + name);
    }
}
