package org.wingshape.io.csv;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Raw text of a CSV file as read: header plus data rows, each row padded to the header width.
 * Kept so that rewritten tables can copy non-coefficient columns untouched.
 */
public record CsvTable(List<String> header, List<List<String>> rows) {

    public CsvTable {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        header = List.copyOf(header);
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    /** @return index of the column, or -1 */
    public int columnIndex(String name) {
        return header.indexOf(name);
    }
}
