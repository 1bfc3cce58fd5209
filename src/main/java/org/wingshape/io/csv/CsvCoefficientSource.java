package org.wingshape.io.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.diagnostics.DataFormatException;
import org.wingshape.io.CoefficientSource;
import org.wingshape.model.CoefficientLayout;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.HarmonicCoefficients;
import org.wingshape.model.Specimen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * CSV implementation of CoefficientSource.
 *
 * Expected CSV shape: a header row followed by one row per specimen
 * image_id,species,gender,a1,a2,...,d10
 * W-001,Lucilia sericata,female,0.98,...
 *
 * Columns not named by the format or the layout are carried along untouched in {@link #table()}.
 */
public final class CsvCoefficientSource implements CoefficientSource {

    private static final Logger log = LoggerFactory.getLogger(CsvCoefficientSource.class);

    private final String description;
    private final InputStreamSupplier streamSupplier;
    private final CsvFormat format;
    private final CoefficientLayout layout;

    // Cached after first load
    private volatile Loaded cached;

    private final Object lock = new Object();

    public CsvCoefficientSource(String description,
                                InputStreamSupplier streamSupplier,
                                CsvFormat format,
                                CoefficientLayout layout) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must be non-empty");
        }
        this.description = description;
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
    }

    public static CsvCoefficientSource ofFile(Path file, CsvFormat format, CoefficientLayout layout) {
        Objects.requireNonNull(file, "file must not be null");
        return new CsvCoefficientSource(file.toString(), () -> Files.newInputStream(file), format, layout);
    }

    @Override
    public CoefficientLayout layout() {
        return layout;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public CoefficientStore load() {
        return loaded().store;
    }

    /**
     * The raw table behind {@link #load()}, in the same row order.
     */
    public CsvTable table() {
        return loaded().table;
    }

    private Loaded loaded() {
        Loaded local = cached;
        if (local != null) {
            return local;
        }
        synchronized (lock) {
            if (cached == null) {
                cached = loadOnce();
            }
            return cached;
        }
    }

    private Loaded loadOnce() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();

        List<String> header;
        List<List<String>> rows = new ArrayList<>();

        try (InputStream in = streamSupplier.open();
             MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(in)) {

            if (!it.hasNext()) {
                throw new DataFormatException(description, "CSV input is empty");
            }
            header = Arrays.asList(it.next());

            while (it.hasNext()) {
                String[] raw = it.next();
                List<String> row = new ArrayList<>(Arrays.asList(raw));
                // Short rows are padded so that missing trailing cells read as blank
                while (row.size() < header.size()) {
                    row.add("");
                }
                rows.add(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read coefficient table '" + description + "'", e);
        }

        CsvTable table = new CsvTable(header, rows);
        ColumnMap columns = resolveColumns(table);

        if (rows.isEmpty()) {
            throw new DataFormatException(description, "CSV has a header but no specimen rows");
        }

        List<Specimen> specimens = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            specimens.add(parseRow(table.rows().get(r), r + 1, columns));
        }

        CoefficientStore store;
        try {
            store = new CoefficientStore(specimens);
        } catch (IllegalArgumentException e) {
            throw new DataFormatException(description, e.getMessage(), e);
        }

        log.info("Loaded {} specimens (H={}) from {}", store.size(), layout.harmonics(), description);
        return new Loaded(store, table);
    }

    private ColumnMap resolveColumns(CsvTable table) {
        List<String> missing = new ArrayList<>();

        int species = table.columnIndex(format.speciesColumn());
        if (species < 0) missing.add(format.speciesColumn());
        int sex = table.columnIndex(format.sexColumn());
        if (sex < 0) missing.add(format.sexColumn());

        int[] coefficients = new int[layout.size()];
        for (int j = 0; j < layout.size(); j++) {
            String name = layout.columnName(j);
            coefficients[j] = table.columnIndex(name);
            if (coefficients[j] < 0) missing.add(name);
        }

        if (!missing.isEmpty()) {
            throw new DataFormatException(description, "required columns are missing: " + missing);
        }

        int id = format.idColumn() == null ? -1 : table.columnIndex(format.idColumn());
        if (id < 0 && format.idColumn() != null) {
            log.debug("No '{}' column in {}, using row numbers as ids", format.idColumn(), description);
        }
        return new ColumnMap(id, species, sex, coefficients);
    }

    private Specimen parseRow(List<String> row, int rowNumber, ColumnMap columns) {
        String id = columns.id < 0 ? "row-" + rowNumber : row.get(columns.id);
        String where = "row " + rowNumber + " (id=" + id + ") of " + description;
        if (id == null || id.isBlank()) {
            throw new DataFormatException(where, "blank identifier in column '" + format.idColumn() + "'");
        }

        String species = row.get(columns.species);
        if (species == null || species.isBlank()) {
            throw new DataFormatException(where, "blank species");
        }
        String sex = row.get(columns.sex);
        if (sex == null || sex.isBlank()) {
            throw new DataFormatException(where, "blank sex in column '" + format.sexColumn() + "'");
        }

        double[] values = new double[layout.size()];
        for (int j = 0; j < values.length; j++) {
            String cell = row.get(columns.coefficients[j]);
            String name = layout.columnName(j);
            if (cell == null || cell.isBlank()) {
                throw new DataFormatException(where, "missing coefficient " + name);
            }
            try {
                values[j] = Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                throw new DataFormatException(where, "coefficient " + name + " is not a number: '" + cell + "'", e);
            }
            if (!Double.isFinite(values[j])) {
                throw new DataFormatException(where, "coefficient " + name + " is not finite: " + cell);
            }
        }

        return new Specimen(id, species, sex, new HarmonicCoefficients(layout, values));
    }

    private record ColumnMap(int id, int species, int sex, int[] coefficients) { }

    private record Loaded(CoefficientStore store, CsvTable table) { }

    /**
     * Simple functional interface so callers can provide:
     * - a file stream
     * - a classpath resource stream
     * - an in-memory stream in tests
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
