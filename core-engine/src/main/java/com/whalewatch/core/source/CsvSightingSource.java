package com.whalewatch.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.whalewatch.core.error.InvalidArgumentException;
import com.whalewatch.core.model.SightingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads sightings from a delimited file with the column layout
 * {@code date, category, latitude, longitude}.
 *
 * <p>
 * The first row is a header and is skipped. Dates are {@code M/d/yy} or
 * {@code M/d/yyyy}, optionally followed by {@code H:mm} or {@code H:mm:ss};
 * two-digit years map to 1969&ndash;2068. Empty lines are ignored.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * A row with the wrong number of columns, an unparseable date or number, or
 * an out-of-range coordinate fails the whole load with an
 * {@link InvalidArgumentException} naming the data row. Rows are never
 * skipped silently.
 * </p>
 *
 * @since 1.0.0
 */
public final class CsvSightingSource implements SightingSource {

    private static final Logger LOG = LoggerFactory.getLogger(CsvSightingSource.class);

    private static final int COLUMN_COUNT = 4;

    static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("M/d/")
            .appendValueReduced(ChronoField.YEAR, 2, 4, LocalDate.of(1969, 1, 1))
            .optionalStart()
            .appendLiteral(' ')
            .appendPattern("H:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private final String description;
    private final StreamOpener opener;
    private final char separator;

    private CsvSightingSource(String description, StreamOpener opener, char separator) {
        this.description = description;
        this.opener = opener;
        this.separator = separator;
    }

    /**
     * @param path comma-separated file; must not be {@code null}
     * @return source reading {@code path} on every {@link #load()}
     */
    public static CsvSightingSource fromFile(Path path) {
        return fromFile(path, ',');
    }

    public static CsvSightingSource fromFile(Path path, char separator) {
        Objects.requireNonNull(path, "Sightings file path must not be null");
        return new CsvSightingSource(path.toString(), () -> Files.newInputStream(path), separator);
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return source reading the resource on every {@link #load()}
     */
    public static CsvSightingSource fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return new CsvSightingSource("classpath:" + resource, () -> {
            InputStream is = CsvSightingSource.class.getClassLoader().getResourceAsStream(resource);
            if (is == null) {
                throw new FileNotFoundException(resource);
            }
            return is;
        }, ',');
    }

    /**
     * @throws IllegalArgumentException if the file or resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws InvalidArgumentException if any row is malformed
     */
    @Override
    public List<SightingEvent> load() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        CsvSchema schema = CsvSchema.emptySchema()
                .withColumnSeparator(separator)
                .withSkipFirstDataRow(true);

        List<SightingEvent> events = new ArrayList<>();
        try (InputStream is = opener.open();
                Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
                MappingIterator<String[]> rows = mapper.readerFor(String[].class)
                        .with(schema)
                        .readValues(reader)) {
            int rowNumber = 0;
            while (rows.hasNextValue()) {
                rowNumber++;
                events.add(parseRow(rows.nextValue(), rowNumber));
            }
        } catch (FileNotFoundException | NoSuchFileException e) {
            throw new IllegalArgumentException("Sightings source not found: " + description, e);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException(
                    "Malformed delimited data in " + description + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sightings from " + description, e);
        }

        LOG.info("Loaded {} sighting(s) from {}", events.size(), description);
        return events;
    }

    /**
     * Convert one data row. Public so other readers can share the row rules.
     *
     * @param row       raw column values
     * @param rowNumber 1-based data row number for error messages
     * @return the parsed sighting
     * @throws InvalidArgumentException if the row is malformed
     */
    public static SightingEvent parseRow(String[] row, int rowNumber) {
        if (row == null || row.length != COLUMN_COUNT) {
            throw new InvalidArgumentException("Malformed sighting at data row " + rowNumber
                    + ": expected " + COLUMN_COUNT + " columns, got " + (row == null ? 0 : row.length));
        }
        try {
            LocalDateTime timestamp = LocalDateTime.parse(row[0].trim(), DATE_FORMAT);
            double latitude = Double.parseDouble(row[2].trim());
            double longitude = Double.parseDouble(row[3].trim());
            return SightingEvent.builder()
                    .timestamp(timestamp)
                    .category(row[1].trim())
                    .location(latitude, longitude)
                    .build();
        } catch (DateTimeParseException | NumberFormatException | InvalidArgumentException e) {
            throw new InvalidArgumentException(
                    "Malformed sighting at data row " + rowNumber + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "CsvSightingSource{" + description + '}';
    }

    @FunctionalInterface
    private interface StreamOpener {
        InputStream open() throws IOException;
    }
}
