package im.arun.regingest.cli;

import picocli.CommandLine;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code --from-date}/{@code --to-date} values: ISO dates, "today", "yesterday" and
 * relative phrases such as "3 days ago" or "1 week ago".
 */
public class DateArgumentConverter implements CommandLine.ITypeConverter<LocalDate> {
    private static final Pattern RELATIVE = Pattern.compile("(\\d+)\\s+(day|days|week|weeks)\\s+ago");

    private final Clock clock;

    public DateArgumentConverter() {
        this(Clock.systemDefaultZone());
    }

    public DateArgumentConverter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LocalDate convert(String value) {
        String text = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);
        if ("today".equals(text)) {
            return today;
        }
        if ("yesterday".equals(text)) {
            return today.minusDays(1);
        }
        Matcher relative = RELATIVE.matcher(text);
        if (relative.matches()) {
            long amount = Long.parseLong(relative.group(1));
            return relative.group(2).startsWith("week") ? today.minusWeeks(amount) : today.minusDays(amount);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new CommandLine.TypeConversionException("Invalid date '" + value
                    + "': use yyyy-MM-dd, today, yesterday or 'N days ago'");
        }
    }
}
