package space.ketterling.climate.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Precipitation by date, one entry per date, always iterated in ascending
 * date order. Values may be null.
 */
public final class PrecipitationSeries {
    private final NavigableMap<LocalDate, Double> byDate;

    public PrecipitationSeries(Map<LocalDate, Double> values) {
        this.byDate = Collections.unmodifiableNavigableMap(new TreeMap<>(values));
    }

    public NavigableMap<LocalDate, Double> entries() {
        return byDate;
    }

    public Double get(LocalDate date) {
        return byDate.get(date);
    }

    public boolean containsDate(LocalDate date) {
        return byDate.containsKey(date);
    }

    public int size() {
        return byDate.size();
    }

    @Override
    public String toString() {
        return "PrecipitationSeries" + byDate;
    }
}
