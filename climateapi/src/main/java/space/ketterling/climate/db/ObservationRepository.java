package space.ketterling.climate.db;

import space.ketterling.climate.model.DatePrecipitation;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to the daily observation dataset.
 *
 * <p>
 * Implementations propagate storage failures as exceptions; callers do not
 * retry.
 * </p>
 */
public interface ObservationRepository {

    /**
     * Latest observation date in the whole dataset, or null when it is empty.
     */
    LocalDate maxDate() throws Exception;

    /**
     * MIN/AVG/MAX of tobs for {@code date >= start} and, when {@code end} is
     * non-null, {@code date <= end}. Bounds compare lexicographically against
     * stored dates.
     */
    TemperatureAggregate queryTemperatureStats(String start, String end) throws Exception;

    /**
     * All (date, prcp) rows with {@code date >= since}, in fetch order.
     */
    List<DatePrecipitation> queryDatePrcp(LocalDate since) throws Exception;

    /**
     * All tobs values (nulls included) with {@code date >= since}, in fetch
     * order.
     */
    List<Double> queryTobs(LocalDate since) throws Exception;

    /**
     * Distinct station ids, ordered by id.
     */
    List<String> distinctStations() throws Exception;

    /**
     * Raw aggregate row. All three fields are null when no row qualified.
     */
    record TemperatureAggregate(Double min, Double avg, Double max) {
        public static TemperatureAggregate empty() {
            return new TemperatureAggregate(null, null, null);
        }

        public boolean isEmpty() {
            return min == null && avg == null && max == null;
        }
    }
}
