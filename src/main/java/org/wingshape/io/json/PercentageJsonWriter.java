package org.wingshape.io.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.variance.PercentageTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the percentage table as a JSON array of
 * { "configuration": "...", "term": "...", "percent": 12.3 } objects.
 */
public final class PercentageJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(PercentageJsonWriter.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public void write(Path target, PercentageTable table) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), table.rows());
        log.info("Wrote {} percentage rows to {}", table.rows().size(), target);
    }

    public String toJson(PercentageTable table) throws IOException {
        Objects.requireNonNull(table, "table must not be null");
        return mapper.writeValueAsString(table.rows());
    }
}
