package im.arun.regingest.source;

import im.arun.regingest.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date window of a load. Either end may be null for sources that ignore dates.
 */
@Value
public class DateRange {
    LocalDate from;
    LocalDate to;

    public static DateRange none() {
        return new DateRange(null, null);
    }

    public static DateRange of(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("from-date " + from + " is after to-date " + to);
        }
        return new DateRange(from, to);
    }

    public boolean isBounded() {
        return from != null && to != null;
    }

    @Override
    public String toString() {
        return isBounded() ? from + ".." + to : "unbounded";
    }
}
