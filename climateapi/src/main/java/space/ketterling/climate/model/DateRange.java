package space.ketterling.climate.model;

import java.util.Objects;

/**
 * Validated date range. {@code end} is null for an open range.
 *
 * <p>
 * Bounds are the caller's strings as validated, compared against stored
 * {@code YYYY-MM-DD} dates lexicographically. When both bounds are present,
 * {@code start <= end} holds.
 * </p>
 */
public record DateRange(String start, String end) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        if (end != null && start.compareTo(end) > 0)
            throw new IllegalArgumentException("start " + start + " is after end " + end);
    }

    public static DateRange from(String start) {
        return new DateRange(start, null);
    }

    public boolean isOpen() {
        return end == null;
    }
}
