package space.ketterling.climate.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import space.ketterling.climate.db.InMemoryObservationRepository;
import space.ketterling.climate.db.ObservationRepository;
import space.ketterling.climate.db.ObservationRepository.TemperatureAggregate;
import space.ketterling.climate.model.DateRange;
import space.ketterling.climate.model.TemperatureStats;

import java.sql.SQLException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemperatureAggregatorTest {
    private final TemperatureAggregator aggregator = new TemperatureAggregator();

    @Mock
    ObservationRepository repo;

    private static InMemoryObservationRepository tenDays() {
        InMemoryObservationRepository r = new InMemoryObservationRepository();
        for (int d = 1; d <= 10; d++) {
            r.add("USC00519397", String.format("2010-01-%02d", d), 60.0 + d, 0.1);
        }
        return r;
    }

    @Test
    void closedRangeIsInclusiveOnBothEnds() throws Exception {
        Optional<TemperatureStats> stats = aggregator.aggregate(tenDays(), new DateRange("2010-01-02", "2010-01-04"));

        assertThat(stats).isPresent();
        assertThat(stats.get().min()).isEqualTo(62.0);
        assertThat(stats.get().avg()).isCloseTo(63.0, within(1e-9));
        assertThat(stats.get().max()).isEqualTo(64.0);
    }

    @Test
    void openRangeRunsToEndOfData() throws Exception {
        TemperatureStats stats = aggregator.aggregate(tenDays(), DateRange.from("2010-01-09")).orElseThrow();

        assertThat(stats.asList()).containsExactly(69.0, 69.5, 70.0);
    }

    @Test
    void nullReadingsAreIgnored() throws Exception {
        InMemoryObservationRepository r = new InMemoryObservationRepository()
                .add("A", "2012-05-01", 70.0, null)
                .add("B", "2012-05-01", null, 0.3)
                .add("A", "2012-05-02", 80.0, null);

        TemperatureStats stats = aggregator.aggregate(r, DateRange.from("2012-05-01")).orElseThrow();

        assertThat(stats.min()).isEqualTo(70.0);
        assertThat(stats.avg()).isEqualTo(75.0);
        assertThat(stats.max()).isEqualTo(80.0);
    }

    @Test
    void rangeAfterDataIsEmptyNotZero() throws Exception {
        assertThat(aggregator.aggregate(tenDays(), DateRange.from("2020-01-01"))).isEmpty();
    }

    @Test
    void rangeWithOnlyNullReadingsIsEmpty() throws Exception {
        InMemoryObservationRepository r = new InMemoryObservationRepository()
                .add("A", "2012-05-01", null, 0.3);

        assertThat(aggregator.aggregate(r, DateRange.from("2012-05-01"))).isEmpty();
    }

    @Test
    void statsAreOrdered() throws Exception {
        TemperatureStats s = aggregator.aggregate(tenDays(), DateRange.from("2010-01-01")).orElseThrow();

        assertThat(s.min()).isLessThanOrEqualTo(s.avg());
        assertThat(s.avg()).isLessThanOrEqualTo(s.max());
    }

    @Test
    void passesNormalizedBoundsToRepository() throws Exception {
        when(repo.queryTemperatureStats("2010-01-01", "2010-01-03"))
                .thenReturn(new TemperatureAggregate(61.0, 62.0, 63.0));

        DateRange range = new DateRangeValidator().validate("2010-01-03", "2010-01-01");
        TemperatureStats stats = aggregator.aggregate(repo, range).orElseThrow();

        verify(repo).queryTemperatureStats("2010-01-01", "2010-01-03");
        assertThat(stats.asList()).containsExactly(61.0, 62.0, 63.0);
    }

    @Test
    void allNullAggregateRowIsEmpty() throws Exception {
        when(repo.queryTemperatureStats("2030-01-01", null)).thenReturn(TemperatureAggregate.empty());

        assertThat(aggregator.aggregate(repo, DateRange.from("2030-01-01"))).isEmpty();
    }

    @Test
    void repositoryFailurePropagates() throws Exception {
        when(repo.queryTemperatureStats("2010-01-01", null)).thenThrow(new SQLException("connection lost"));

        assertThatThrownBy(() -> aggregator.aggregate(repo, DateRange.from("2010-01-01")))
                .isInstanceOf(SQLException.class)
                .hasMessage("connection lost");
    }
}
