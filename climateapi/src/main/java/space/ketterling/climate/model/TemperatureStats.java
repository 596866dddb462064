package space.ketterling.climate.model;

import java.util.List;

/**
 * Min, mean and max of the non-null temperature readings in a range.
 */
public record TemperatureStats(double min, double avg, double max) {

    /**
     * Wire shape: {@code [min, avg, max]}.
     */
    public List<Double> asList() {
        return List.of(min, avg, max);
    }
}
