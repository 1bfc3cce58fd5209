package org.wingshape.io.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.model.CoefficientLayout;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.Specimen;
import org.wingshape.variance.PercentageTable;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes the tables handed to downstream reporting: normalized coefficients, percentage
 * contributions and principal-component scores. Rows are written as plain string arrays.
 */
public final class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    private final CsvMapper mapper = new CsvMapper();

    /**
     * Rewrites {@code original} with the coefficient cells replaced by those of {@code normalized}.
     * Every other column is copied as read. Both must list the same specimens in the same order.
     */
    public void writeNormalized(Path target, CsvTable original, CoefficientStore normalized) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
        if (original.rows().size() != normalized.size()) {
            throw new IllegalArgumentException(
                    "Row count mismatch: table has " + original.rows().size() + " rows, store has " + normalized.size()
            );
        }

        CoefficientLayout layout = normalized.layout();
        int[] targetColumns = new int[layout.size()];
        for (int j = 0; j < layout.size(); j++) {
            targetColumns[j] = original.columnIndex(layout.columnName(j));
            if (targetColumns[j] < 0) {
                throw new IllegalArgumentException("Column " + layout.columnName(j) + " is absent from the table");
            }
        }

        List<String[]> rows = new ArrayList<>(original.rows().size() + 1);
        rows.add(original.header().toArray(new String[0]));
        for (int i = 0; i < normalized.size(); i++) {
            String[] row = original.rows().get(i).toArray(new String[0]);
            double[] values = normalized.get(i).coefficients().toArrayCopy();
            for (int j = 0; j < values.length; j++) {
                row[targetColumns[j]] = Double.toString(values[j]);
            }
            rows.add(row);
        }
        writeRows(target, rows);
        log.info("Wrote {} normalized specimens to {}", normalized.size(), target);
    }

    /**
     * Writes a store that was not read from a file: id, species, sex and the coefficient columns.
     */
    public void writeNormalized(Path target, CoefficientStore normalized, CsvFormat format) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
        Objects.requireNonNull(format, "format must not be null");

        List<String> header = new ArrayList<>();
        header.add(format.idColumn() == null ? CsvFormat.DEFAULT_ID_COLUMN : format.idColumn());
        header.add(format.speciesColumn());
        header.add(format.sexColumn());
        header.addAll(normalized.layout().columnNames());

        List<String[]> rows = new ArrayList<>(normalized.size() + 1);
        rows.add(header.toArray(new String[0]));
        for (Specimen s : normalized.specimens()) {
            double[] values = s.coefficients().toArrayCopy();
            String[] row = new String[3 + values.length];
            row[0] = s.id();
            row[1] = s.species();
            row[2] = s.sex();
            for (int j = 0; j < values.length; j++) row[3 + j] = Double.toString(values[j]);
            rows.add(row);
        }
        writeRows(target, rows);
        log.info("Wrote {} normalized specimens to {}", normalized.size(), target);
    }

    /** configuration,term,percent */
    public void writePercentages(Path target, PercentageTable table) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(table, "table must not be null");

        List<String[]> rows = new ArrayList<>(table.rows().size() + 1);
        rows.add(new String[]{"configuration", "term", "percent"});
        for (PercentageTable.Row r : table.rows()) {
            rows.add(new String[]{r.configuration(), r.term(), Double.toString(r.percent())});
        }
        writeRows(target, rows);
        log.info("Wrote {} percentage rows to {}", table.rows().size(), target);
    }

    /**
     * id,species,sex,PC1..PCk where k is the score matrix width.
     */
    public void writeScores(Path target, CoefficientStore store, RealMatrix scores) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        if (scores.getRowDimension() != store.size()) {
            throw new IllegalArgumentException(
                    "Row count mismatch: " + scores.getRowDimension() + " score rows for " + store.size() + " specimens"
            );
        }

        int k = scores.getColumnDimension();
        String[] header = new String[3 + k];
        header[0] = "id";
        header[1] = "species";
        header[2] = "sex";
        for (int j = 0; j < k; j++) header[3 + j] = "PC" + (j + 1);

        List<String[]> rows = new ArrayList<>(store.size() + 1);
        rows.add(header);
        for (int i = 0; i < store.size(); i++) {
            Specimen s = store.get(i);
            String[] row = new String[3 + k];
            row[0] = s.id();
            row[1] = s.species();
            row[2] = s.sex();
            for (int j = 0; j < k; j++) row[3 + j] = Double.toString(scores.getEntry(i, j));
            rows.add(row);
        }
        writeRows(target, rows);
        log.info("Wrote {} PC scores to {}", store.size(), target);
    }

    private void writeRows(Path target, List<String[]> rows) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter seq = mapper.writer().writeValues(out)) {
            for (String[] row : rows) {
                seq.write(row);
            }
        }
    }
}
