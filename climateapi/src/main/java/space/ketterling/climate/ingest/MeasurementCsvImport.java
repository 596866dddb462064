/*
* Copyright 2025 Taylor Ketterling
* Measurement CSV import for ClimateAPI, a daily climate observation query service.
* Loads station/date/prcp/tobs rows from a plain or gzip-compressed CSV file into the
* measurement table, keeping file order so the API sees rows in load order.
*/
package space.ketterling.climate.ingest;

import com.zaxxer.hikari.HikariDataSource;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climate.config.AppConfig;
import space.ketterling.climate.db.Database;
import space.ketterling.climate.db.MeasurementRepo;
import space.ketterling.climate.model.Observation;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Imports a measurement CSV ({@code station,date,prcp,tobs}) into the
 * {@code measurement} table.
 *
 * <p>
 * Header names are matched case-insensitively and extra columns are ignored.
 * Rows without a station or a {@code yyyy-mm-dd} date are skipped; empty or
 * non-numeric readings load as null. A file is committed as a whole, so a
 * failed run leaves no rows behind and the startup import retries it.
 * </p>
 */
public class MeasurementCsvImport {
    private static final Logger log = LoggerFactory.getLogger(MeasurementCsvImport.class);
    private static final Pattern DATE_PREFIX = Pattern.compile("^[0-9]{4}-[0-9]{2}-[0-9]{2}");
    private static final int CHUNK_ROWS = 5_000;

    /**
     * Outcome of one import run.
     */
    public record Result(int written, int skipped) {
    }

    /**
     * CLI entry point. Optionally pass the CSV path; otherwise the configured
     * {@code import.measurementCsv} is used.
     */
    public static void main(String[] args) throws Exception {
        AppConfig cfg = AppConfig.load();
        Path csv = Path.of(args.length > 0 ? args[0] : cfg.measurementCsv());
        if (!Files.isRegularFile(csv)) {
            log.error("Measurement CSV not found: {}", csv.toAbsolutePath());
            System.exit(2);
            return;
        }

        try (HikariDataSource ds = Database.createImportDataSource(cfg)) {
            MeasurementRepo repo = new MeasurementRepo(ds);
            repo.ensureTable();
            Result r = importFile(csv, repo);
            log.info("Measurement import completed, written={} skipped={}", r.written(), r.skipped());
        }
    }

    /**
     * Runs the import on startup when the table is empty and the CSV exists.
     *
     * @return rows written, 0 when nothing was imported
     */
    public static int importIfEmpty(Path csv, MeasurementRepo repo) throws Exception {
        repo.ensureTable();
        if (repo.count() > 0) {
            log.debug("measurement table already populated, skipping import");
            return 0;
        }
        if (csv == null || !Files.isRegularFile(csv)) {
            log.warn("measurement table is empty and no CSV found at {}", csv);
            return 0;
        }
        return importFile(csv, repo).written();
    }

    /**
     * Reads {@code csv} (gzip when the name ends in .gz) and writes its rows.
     */
    public static Result importFile(Path csv, MeasurementRepo repo) throws Exception {
        log.info("Importing measurements from {}", csv);
        try (InputStream in = open(csv);
                BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return importRows(br, repo, csv.getFileName().toString());
        }
    }

    private static InputStream open(Path csv) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(csv));
        if (csv.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz")) {
            try {
                return new GzipCompressorInputStream(raw);
            } catch (IOException e) {
                raw.close();
                throw e;
            }
        }
        return raw;
    }

    static Result importRows(BufferedReader br, MeasurementRepo repo, String source) throws Exception {
        String headerLine = br.readLine();
        if (headerLine == null) {
            log.info("Skipping {}: empty file", source);
            return new Result(0, 0);
        }

        Map<String, Integer> idx = new HashMap<>();
        List<String> header = parseCsvLine(stripBom(headerLine));
        for (int i = 0; i < header.size(); i++)
            idx.put(header.get(i).trim().toLowerCase(Locale.ROOT), i);

        Integer iStation = idx.get("station");
        Integer iDate = idx.get("date");
        if (iStation == null || iDate == null)
            throw new IllegalArgumentException(source + ": header must contain station and date columns, got " + header);
        Integer iPrcp = idx.get("prcp");
        Integer iTobs = idx.get("tobs");

        int written = 0;
        int skipped = 0;
        int lineNo = 1;
        List<Observation> chunk = new ArrayList<>(CHUNK_ROWS);
        // the whole file is one transaction; a failure leaves the table as it was
        try (MeasurementRepo.Writer writer = repo.openWriter()) {
            String line;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank())
                    continue;

                List<String> cols = parseCsvLine(line);
                String station = col(cols, iStation);
                String dateRaw = col(cols, iDate);
                LocalDate date = parseDate(dateRaw);
                if (station == null || station.isBlank() || date == null) {
                    log.debug("{}:{} skipped (station={}, date={})", source, lineNo, station, dateRaw);
                    skipped++;
                    continue;
                }

                chunk.add(new Observation(station.trim(), date,
                        parseMaybeNumber(col(cols, iTobs)),
                        parseMaybeNumber(col(cols, iPrcp))));
                if (chunk.size() >= CHUNK_ROWS) {
                    written += writer.write(chunk);
                    chunk.clear();
                    log.info("{}: {} rows written so far", source, written);
                }
            }
            written += writer.write(chunk);
            writer.commit();
        }

        log.info("{}: imported {} rows, skipped {}", source, written, skipped);
        return new Result(written, skipped);
    }

    private static String col(List<String> cols, Integer i) {
        if (i == null || i >= cols.size())
            return null;
        return cols.get(i);
    }

    private static LocalDate parseDate(String s) {
        if (s == null || !DATE_PREFIX.matcher(s.trim()).lookingAt())
            return null;
        try {
            return LocalDate.parse(s.trim().substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    /**
     * Minimal CSV splitter that respects double quotes.
     */
    static List<String> parseCsvLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == ',' && !inQuotes) {
                out.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString().trim());
        return out;
    }

    /**
     * Parses a numeric cell; blank, NaN or non-numeric cells become null.
     */
    static Double parseMaybeNumber(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isNaN(v) ? null : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
