package space.ketterling.climate.query;

import space.ketterling.climate.db.ObservationRepository;
import space.ketterling.climate.db.ObservationRepository.TemperatureAggregate;
import space.ketterling.climate.model.DateRange;
import space.ketterling.climate.model.TemperatureStats;

import java.util.Optional;

/**
 * Min/avg/max temperature over a validated date range.
 */
public final class TemperatureAggregator {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(TemperatureAggregator.class);

    /**
     * Returns the stats for {@code range}, or empty when no reading falls in
     * it. Null readings never count.
     */
    public Optional<TemperatureStats> aggregate(ObservationRepository repo, DateRange range) throws Exception {
        TemperatureAggregate row = repo.queryTemperatureStats(range.start(), range.end());
        if (row == null || row.isEmpty()) {
            log.debug("No temperature rows for {}..{}", range.start(), range.isOpen() ? "" : range.end());
            return Optional.empty();
        }
        if (row.min() == null || row.avg() == null || row.max() == null)
            throw new IllegalStateException("Partial temperature aggregate: " + row);
        return Optional.of(new TemperatureStats(row.min(), row.avg(), row.max()));
    }
}
