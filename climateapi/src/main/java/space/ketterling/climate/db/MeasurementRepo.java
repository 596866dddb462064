/*
* Copyright 2025 Taylor Ketterling
* Measurement Repository for ClimateAPI, a daily climate observation query service.
* Utilizes HikariCP for database connection pooling and reads the measurement table
* that backs every query route.
*/
package space.ketterling.climate.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.climate.model.DatePrecipitation;
import space.ketterling.climate.model.Observation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Database access for daily station measurements.
 *
 * <p>
 * Dates are stored as {@code YYYY-MM-DD} text so range filters compare the
 * same way the request strings do. Rows are fetched in load order (identity
 * {@code id}).
 * </p>
 */
public class MeasurementRepo implements ObservationRepository {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(MeasurementRepo.class);
    private static final int BATCH_SIZE = 500;

    private final HikariDataSource ds;

    /**
     * Creates a repo backed by the provided datasource.
     */
    public MeasurementRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Creates the measurement table if it does not exist.
     */
    public void ensureTable() throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS measurement (
                    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    station VARCHAR(64) NOT NULL,
                    date VARCHAR(32) NOT NULL,
                    prcp DOUBLE PRECISION,
                    tobs DOUBLE PRECISION,
                    UNIQUE (station, date)
                )
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        }
        log.debug("measurement table ready");
    }

    @Override
    public LocalDate maxDate() throws Exception {
        String sql = "SELECT MAX(date) FROM measurement";
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next())
                return null;
            String d = rs.getString(1);
            return d == null ? null : parseDate(d);
        }
    }

    @Override
    public TemperatureAggregate queryTemperatureStats(String start, String end) throws Exception {
        String sql = "SELECT MIN(tobs) AS tmin, AVG(tobs) AS tavg, MAX(tobs) AS tmax FROM measurement " +
                "WHERE date >= ?" + (end != null ? " AND date <= ?" : "");

        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, start);
            if (end != null)
                ps.setString(2, end);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return TemperatureAggregate.empty();
                return new TemperatureAggregate(
                        getNullableDouble(rs, "tmin"),
                        getNullableDouble(rs, "tavg"),
                        getNullableDouble(rs, "tmax"));
            }
        }
    }

    @Override
    public List<DatePrecipitation> queryDatePrcp(LocalDate since) throws Exception {
        String sql = "SELECT date, prcp FROM measurement WHERE date >= ? ORDER BY id";
        List<DatePrecipitation> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, since.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new DatePrecipitation(parseDate(rs.getString("date")), getNullableDouble(rs, "prcp")));
                }
            }
        }
        log.debug("queryDatePrcp since={} -> {} rows", since, out.size());
        return out;
    }

    @Override
    public List<Double> queryTobs(LocalDate since) throws Exception {
        String sql = "SELECT tobs FROM measurement WHERE date >= ? ORDER BY id";
        List<Double> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, since.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(getNullableDouble(rs, "tobs"));
                }
            }
        }
        log.debug("queryTobs since={} -> {} rows", since, out.size());
        return out;
    }

    @Override
    public List<String> distinctStations() throws Exception {
        String sql = "SELECT DISTINCT station FROM measurement ORDER BY station";
        List<String> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
        }
        return out;
    }

    /**
     * Number of stored measurement rows.
     */
    public long count() throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM measurement");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Inserts observations in list order, batched in one transaction.
     *
     * @return number of rows written
     */
    public int insertAll(List<Observation> rows) throws SQLException {
        if (rows.isEmpty())
            return 0;
        try (Writer w = openWriter()) {
            int written = w.write(rows);
            w.commit();
            return written;
        }
    }

    /**
     * Opens a writer whose rows become visible only on {@link Writer#commit()}.
     * Closing an uncommitted writer rolls back everything it wrote.
     */
    public Writer openWriter() throws SQLException {
        return new Writer(ds.getConnection());
    }

    /**
     * One insert transaction on a dedicated connection.
     */
    public static final class Writer implements AutoCloseable {
        private final Connection c;
        private final boolean autoCommit;
        private final PreparedStatement ps;
        private boolean committed;
        private int written;

        private Writer(Connection c) throws SQLException {
            this.c = c;
            try {
                this.autoCommit = c.getAutoCommit();
                c.setAutoCommit(false);
                this.ps = c.prepareStatement(
                        "INSERT INTO measurement (station, date, prcp, tobs) VALUES (?, ?, ?, ?)");
            } catch (SQLException e) {
                c.close();
                throw e;
            }
        }

        /**
         * Adds rows to the open transaction.
         *
         * @return number of rows written by this call
         */
        public int write(List<Observation> rows) throws SQLException {
            int before = written;
            int pending = 0;
            for (Observation o : rows) {
                ps.setString(1, o.station());
                ps.setString(2, o.date().toString());
                setDouble(ps, 3, o.prcp());
                setDouble(ps, 4, o.tobs());
                ps.addBatch();
                if (++pending == BATCH_SIZE) {
                    written += sum(ps.executeBatch());
                    pending = 0;
                }
            }
            if (pending > 0)
                written += sum(ps.executeBatch());
            return written - before;
        }

        public void commit() throws SQLException {
            c.commit();
            committed = true;
            log.debug("insert transaction committed: {} rows", written);
        }

        @Override
        public void close() throws SQLException {
            try {
                if (!committed) {
                    c.rollback();
                    log.warn("insert transaction rolled back, {} rows discarded", written);
                }
            } finally {
                try {
                    ps.close();
                    c.setAutoCommit(autoCommit);
                } finally {
                    c.close();
                }
            }
        }
    }

    /**
     * Stored dates may carry a time suffix; only the day part is used.
     */
    private static LocalDate parseDate(String s) {
        return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
    }

    private static Double getNullableDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    /**
     * Writes a nullable double to a prepared statement.
     */
    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    private static int sum(int[] counts) {
        int n = 0;
        for (int k : counts)
            n += k >= 0 ? k : 1; // SUCCESS_NO_INFO
        return n;
    }
}
