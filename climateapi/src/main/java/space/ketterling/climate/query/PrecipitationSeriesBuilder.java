package space.ketterling.climate.query;

import space.ketterling.climate.db.ObservationRepository;
import space.ketterling.climate.model.DatePrecipitation;
import space.ketterling.climate.model.PrecipitationSeries;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the date to precipitation series for the trailing window.
 */
public final class PrecipitationSeriesBuilder {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(PrecipitationSeriesBuilder.class);

    private final TrailingWindow window;
    private final DuplicateDatePolicy policy;

    public PrecipitationSeriesBuilder() {
        this(new TrailingWindow(), DuplicateDatePolicy.LAST);
    }

    public PrecipitationSeriesBuilder(TrailingWindow window, DuplicateDatePolicy policy) {
        this.window = window;
        this.policy = policy;
    }

    public PrecipitationSeries build(ObservationRepository repo) throws Exception {
        LocalDate since = window.start(repo);
        var rows = repo.queryDatePrcp(since);

        Map<LocalDate, Double> byDate = switch (policy) {
            case LAST -> lastWins(rows);
            case MAX -> combine(rows, false);
            case MEAN -> combine(rows, true);
        };

        log.debug("Precipitation series since={} rows={} dates={} policy={}", since, rows.size(), byDate.size(),
                policy);
        return new PrecipitationSeries(byDate);
    }

    private static Map<LocalDate, Double> lastWins(Iterable<DatePrecipitation> rows) {
        Map<LocalDate, Double> out = new LinkedHashMap<>();
        for (DatePrecipitation r : rows) {
            out.put(r.date(), r.prcp());
        }
        return out;
    }

    private static Map<LocalDate, Double> combine(Iterable<DatePrecipitation> rows, boolean mean) {
        Map<LocalDate, double[]> acc = new LinkedHashMap<>(); // {sum or max, count}
        for (DatePrecipitation r : rows) {
            double[] a = acc.computeIfAbsent(r.date(), k -> new double[] { 0.0, 0.0 });
            if (r.prcp() == null)
                continue;
            double v = r.prcp();
            if (a[1] == 0)
                a[0] = v;
            else
                a[0] = mean ? a[0] + v : Math.max(a[0], v);
            a[1]++;
        }

        Map<LocalDate, Double> out = new HashMap<>();
        for (var e : acc.entrySet()) {
            double[] a = e.getValue();
            if (a[1] == 0)
                out.put(e.getKey(), null);
            else
                out.put(e.getKey(), mean ? a[0] / a[1] : a[0]);
        }
        return out;
    }
}
