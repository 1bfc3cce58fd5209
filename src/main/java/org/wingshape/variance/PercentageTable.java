package org.wingshape.variance;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Percentage contribution of every model term under every configuration, in run order.
 * Each (configuration, term) pair appears once.
 */
public record PercentageTable(List<Row> rows) {

    public PercentageTable {
        Objects.requireNonNull(rows, "rows must not be null");
        rows = List.copyOf(rows);
        Set<List<String>> keys = new HashSet<>();
        for (Row row : rows) {
            if (!keys.add(List.of(row.configuration(), row.term()))) {
                throw new IllegalArgumentException(
                        "Duplicate entry for (" + row.configuration() + ", " + row.term() + ")");
            }
        }
    }

    public static PercentageTable of(List<ConfigurationResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<Row> out = new ArrayList<>();
        for (ConfigurationResult r : results) {
            for (Map.Entry<String, Double> e : r.sscp().percentages().entrySet()) {
                out.add(new Row(r.label(), e.getKey(), e.getValue()));
            }
        }
        return new PercentageTable(out);
    }

    public double percent(String configuration, String term) {
        for (Row row : rows) {
            if (row.configuration().equals(configuration) && row.term().equals(term)) {
                return row.percent();
            }
        }
        throw new IllegalArgumentException("No entry for (" + configuration + ", " + term + ")");
    }

    public List<String> configurations() {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Row row : rows) out.add(row.configuration());
        return List.copyOf(out);
    }

    public List<String> terms() {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Row row : rows) out.add(row.term());
        return List.copyOf(out);
    }

    /**
     * One (configuration, term) cell.
     */
    public record Row(String configuration, String term, double percent) {
        public Row {
            Objects.requireNonNull(configuration, "configuration must not be null");
            Objects.requireNonNull(term, "term must not be null");
        }
    }
}
