package space.ketterling.climate.query;

import space.ketterling.climate.db.ObservationRepository;

import java.time.LocalDate;

/**
 * The span of days ending at the dataset's latest date.
 */
public final class TrailingWindow {
    public static final int DEFAULT_DAYS = 365;

    private final int days;

    public TrailingWindow() {
        this(DEFAULT_DAYS);
    }

    public TrailingWindow(int days) {
        if (days < 1)
            throw new IllegalArgumentException("days must be positive: " + days);
        this.days = days;
    }

    public int days() {
        return days;
    }

    /**
     * Calendar subtraction, so {@code 2017-08-23} gives {@code 2016-08-23}.
     */
    public LocalDate windowStart(LocalDate latest) {
        return latest.minusDays(days);
    }

    /**
     * Window start anchored at {@code repo.maxDate()}.
     *
     * @throws IllegalStateException when the dataset has no rows
     */
    public LocalDate start(ObservationRepository repo) throws Exception {
        LocalDate latest = repo.maxDate();
        if (latest == null)
            throw new IllegalStateException("Observation dataset is empty; no latest date to anchor the window");
        return windowStart(latest);
    }
}
