package space.ketterling.climate.model;

import java.time.LocalDate;

/**
 * A (date, prcp) pair as fetched from the repository; prcp may be null.
 */
public record DatePrecipitation(LocalDate date, Double prcp) {
}
