package space.ketterling.climate.query;

import space.ketterling.climate.db.ObservationRepository;

import java.util.List;

/**
 * Raw temperature readings for the trailing window, unsorted and unfiltered.
 */
public final class RecentObservationsQuery {
    private final TrailingWindow window;

    public RecentObservationsQuery() {
        this(new TrailingWindow());
    }

    public RecentObservationsQuery(TrailingWindow window) {
        this.window = window;
    }

    public List<Double> recentTemperatures(ObservationRepository repo) throws Exception {
        return repo.queryTobs(window.start(repo));
    }
}
