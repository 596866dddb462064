package space.ketterling.climate.query;

import space.ketterling.climate.db.ObservationRepository;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Distinct station ids referenced by the dataset.
 */
public final class StationCatalog {

    /**
     * Iteration order follows the repository, which orders by station id.
     */
    public Set<String> listStations(ObservationRepository repo) throws Exception {
        return Collections.unmodifiableSet(new LinkedHashSet<>(repo.distinctStations()));
    }
}
