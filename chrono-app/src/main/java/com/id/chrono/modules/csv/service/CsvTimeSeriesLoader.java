package com.id.chrono.modules.csv.service;

import com.id.chrono.config.ChronoConfig;
import com.id.chrono.exceptions.ChronoException;
import com.id.chrono.modules.collection.substrate.CollectionSubstrate;
import com.id.chrono.modules.csv.model.enums.CsvDateFormat;
import com.id.chrono.modules.csv.util.CsvDateParser;
import com.id.chrono.modules.series.model.Series;
import com.id.chrono.modules.series.model.TimeSeriesTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads daily quote files (Yahoo, Google, Quandl exports) into tables over an irregular index.
 * The first column holds the date, every other column becomes a series named after its header.
 */
@Component
@Slf4j
public class CsvTimeSeriesLoader {

    private static final String CSV_SUFFIX = ".csv";

    private final char separator;
    private final CsvDateFormat dateFormat;
    private final CollectionSubstrate substrate;

    public CsvTimeSeriesLoader(ChronoConfig config, CollectionSubstrate substrate) {
        this.separator = config.getCsvSeparator();
        this.dateFormat = CsvDateParser.resolveFormat(config.getCsvDateFormat());
        this.substrate = substrate;
    }

    /**
     * Parses with the configured date format.
     */
    public TimeSeriesTable parse(String text) {
        return parse(text, dateFormat);
    }

    /**
     * Rows may come in any order; they are sorted by date. Rows with an unreadable date are skipped,
     * unreadable numbers become {@link Series#MISSING}.
     *
     * @throws com.id.chrono.exceptions.DuplicateTimestampException if two rows share a date
     */
    public TimeSeriesTable parse(String text, CsvDateFormat dateFormat) {
        if (text == null) {
            throw new IllegalArgumentException("CSV text cannot be null");
        }
        List<String> lines = text.lines().filter(line -> !line.isBlank()).toList();
        if (lines.isEmpty()) {
            throw new ChronoException("CSV text has no header row");
        }
        List<String> headers = parseCsvLine(lines.get(0), separator);
        if (headers.size() < 2) {
            throw new ChronoException("CSV header needs a date column and at least one value column, got: " + headers);
        }
        List<String> keys = headers.subList(1, headers.size());

        List<Row> rows = new ArrayList<>(lines.size() - 1);
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            List<String> tokens = parseCsvLine(lines.get(lineNo), separator);
            Optional<Long> tms = CsvDateParser.parse(tokens.get(0), dateFormat);
            if (tms.isEmpty()) {
                log.warn("Skipping CSV line {}: unreadable date '{}'", lineNo + 1, tokens.get(0));
                continue;
            }
            double[] values = new double[keys.size()];
            for (int col = 0; col < values.length; col++) {
                values[col] = col + 1 < tokens.size() ? parseNumber(tokens.get(col + 1)) : Series.MISSING;
            }
            rows.add(new Row(tms.get(), values));
        }
        rows.sort(Comparator.comparingLong(Row::tms));

        long[] timestamps = rows.stream().mapToLong(Row::tms).toArray();
        List<double[]> samples = rows.stream().map(Row::values).toList();
        log.debug("Parsed {} rows, {} series", rows.size(), keys.size());
        return TimeSeriesTable.fromIrregularSamples(timestamps, samples, keys);
    }

    /**
     * Loads every {@code *.csv} file of the directory, one substrate task per file.
     *
     * @return tables keyed by file name, in file name order
     */
    public Map<String, TimeSeriesTable> loadFromDirectory(Path dir) {
        if (dir == null) {
            throw new IllegalArgumentException("Directory cannot be null");
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(CSV_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new ChronoException("Failed to list CSV directory " + dir, e);
        }

        List<TimeSeriesTable> tables = substrate.runPerPartition(files, (id, file) ->
                parse(Files.readString(file, StandardCharsets.UTF_8)));

        Map<String, TimeSeriesTable> out = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            out.put(files.get(i).getFileName().toString(), tables.get(i));
        }
        log.info("Loaded {} CSV files from {}", out.size(), dir);
        return out;
    }

    private static double parseNumber(String token) {
        if (token == null || token.isEmpty()) {
            return Series.MISSING;
        }
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return Series.MISSING;
        }
    }

    /**
     * Splits one line, honouring double quotes ("" inside quotes is a literal quote). Fields are
     * trimmed.
     */
    static List<String> parseCsvLine(String line, char separator) {
        List<String> fields = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cur.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == separator && !inQuotes) {
                fields.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        fields.add(cur.toString().trim());
        return fields;
    }

    private record Row(long tms, double[] values) {
    }
}
