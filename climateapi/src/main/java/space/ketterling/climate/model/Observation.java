package space.ketterling.climate.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One daily reading for a station. {@code tobs} and {@code prcp} may be null
 * when the station did not report them.
 */
public record Observation(String station, LocalDate date, Double tobs, Double prcp) {
    public Observation {
        Objects.requireNonNull(station, "station");
        Objects.requireNonNull(date, "date");
    }
}
