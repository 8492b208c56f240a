package com.dwimerge.core.io;

import com.dwimerge.core.error.FormatException;
import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.model.ConfoundTable;
import com.dwimerge.core.model.QcMetrics;
import com.dwimerge.core.model.SeriesQcRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Delimited text files exchanged with the surrounding pipeline, read and written with Jackson CSV.
 *
 * <ul>
 *   <li>Confounds: tab-separated, header row, one row per volume; {@code n/a} is missing</li>
 *   <li>QC metrics: comma-separated, header row, first data row is the series</li>
 * </ul>
 */
public class TabularFiles {

    private static final Logger log = LoggerFactory.getLogger(TabularFiles.class);
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final Set<String> MISSING = Set.of("", "n/a", "na", "nan");

    /**
     * Reads a per-volume confounds table.
     *
     * @param file tab-separated file with a header row
     * @return numeric columns in file order
     * @throws FormatException if a cell is neither numeric nor a missing marker
     */
    public ConfoundTable readConfounds(Path file) {
        List<Map<String, String>> rows = readRows(file, '\t');
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            row.forEach((name, cell) -> columns.computeIfAbsent(name, key -> new ArrayList<>())
                .add(parse(file, name, cell)));
        }
        return new ConfoundTable(columns);
    }

    /**
     * Reads QC metrics from the first row of a CSV file. Non-numeric columns are skipped.
     *
     * @param file QC file
     * @return metrics in column order
     */
    public QcMetrics readQcMetrics(Path file) {
        List<Map<String, String>> rows = readRows(file, ',');
        if (rows.isEmpty()) {
            throw new FormatException(file.toString(), "QC file has no data row");
        }
        Map<String, Double> values = new LinkedHashMap<>();
        rows.get(0).forEach((name, cell) -> {
            String normalized = cell == null ? "" : cell.trim().toLowerCase(Locale.ROOT);
            if (MISSING.contains(normalized)) {
                values.put(name, Double.NaN);
                return;
            }
            try {
                values.put(name, Double.parseDouble(normalized));
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric QC column '{}' in {}", name, file);
            }
        });
        return new QcMetrics(values);
    }

    /**
     * Writes the series QC record as a one-row CSV file.
     *
     * @param record record to write
     * @param file destination
     * @return {@code file}
     */
    public Path writeSeriesQc(SeriesQcRecord record, Path file) {
        Map<String, Object> row = record.toRow();
        CsvSchema.Builder schema = CsvSchema.builder();
        Map<String, String> cells = new LinkedHashMap<>();
        row.forEach((name, value) -> {
            schema.addColumn(name);
            cells.put(name, format(value));
        });
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            CSV_MAPPER.writer(schema.build().withHeader()).writeValue(file.toFile(), cells);
            return file;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write QC file: " + file, e);
        }
    }

    private static List<Map<String, String>> readRows(Path file, char separator) {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputException(file.toString(), "Table file not found");
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
        try (MappingIterator<Map<String, String>> it = CSV_MAPPER.readerForMapOf(String.class)
            .with(schema)
            .readValues(file.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new FormatException(file.toString(), "Cannot parse table: " + e.getMessage(), e);
        }
    }

    private static double parse(Path file, String column, String cell) {
        String normalized = cell == null ? "" : cell.trim().toLowerCase(Locale.ROOT);
        if (MISSING.contains(normalized)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            throw new FormatException(file.toString(), "Column '" + column + "' holds non-numeric value '" + cell + "'", e);
        }
    }

    private static String format(Object value) {
        if (value instanceof Double d) {
            return Double.isNaN(d) ? "n/a" : String.format(Locale.ROOT, "%.6f", d);
        }
        return value == null ? "" : value.toString();
    }
}
