package space.ketterling.climate.query;

import space.ketterling.climate.model.DateRange;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks request date bounds and puts them in ascending order.
 *
 * <p>
 * Only the leading {@code yyyy-mm-dd} shape is checked; anything after it is
 * kept as part of the bound.
 * </p>
 */
public final class DateRangeValidator {
    private static final Pattern DATE_PREFIX = Pattern.compile("^[0-9]{4}-[0-9]{2}-[0-9]{2}");

    /**
     * Validates an open range starting at {@code start}.
     */
    public DateRange validate(String start) {
        return validate(start, null);
    }

    /**
     * Validates {@code start}/{@code end}; a null end means open-ended.
     * Reversed bounds are swapped.
     *
     * @throws ValidationException naming the rejected bound(s)
     */
    public DateRange validate(String start, String end) {
        boolean startOk = hasDatePrefix(start);
        if (end == null) {
            if (!startOk)
                throw new ValidationException(invalidStartMessage(start), List.of("start"));
            return DateRange.from(start);
        }

        boolean endOk = hasDatePrefix(end);
        if (!startOk || !endOk) {
            List<String> bad = new ArrayList<>(2);
            if (!startOk)
                bad.add("start");
            if (!endOk)
                bad.add("end");
            throw new ValidationException(invalidRangeMessage(start, end), bad);
        }

        if (start.compareTo(end) > 0)
            return new DateRange(end, start);
        return new DateRange(start, end);
    }

    static boolean hasDatePrefix(String s) {
        return s != null && DATE_PREFIX.matcher(s).lookingAt();
    }

    private static String invalidStartMessage(String start) {
        return "Your search of '" + start + "' is not in the correct format.<br/>"
                + "Please, search for a start date in the form yyyy-mm-dd (year-month-day).";
    }

    private static String invalidRangeMessage(String start, String end) {
        return "Your search beginning with '" + start + "' and ending with '" + end + "' "
                + "is not in the correct format.<br/>"
                + "Please, verify that both start and end dates are in the form yyyy-mm-dd (year-month-day).";
    }
}
