package org.wingshape.io.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.wingshape.config.AnalysisConfig;
import org.wingshape.diagnostics.DataFormatException;
import org.wingshape.variance.Coding;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads an {@link AnalysisConfig} from a JSON object. Only "input" is required:
 * <pre>
 * {
 *   "input": "flip_efd_coefficients_10h.csv",
 *   "normalizedOutput": "normalized_efd_coefficients_10h.csv",
 *   "percentOutput": "sscp_percentages.csv",
 *   "pcScoresOutput": "pc_scores.csv",
 *   "harmonics": 10,
 *   "symbols": "abcd",
 *   "speciesColumn": "species",
 *   "sexColumn": "gender",
 *   "idColumn": "image_id",
 *   "contourPoints": 300,
 *   "pcCounts": [10, 20, 30, 40],
 *   "coding": "treatment",
 *   "parallel": false
 * }
 * </pre>
 * Relative paths resolve against the folder of the config file.
 */
public final class AnalysisConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    public AnalysisConfig load(Path configFile) throws IOException {
        Objects.requireNonNull(configFile, "configFile must not be null");
        Path base = configFile.toAbsolutePath().getParent();
        try (InputStream in = Files.newInputStream(configFile)) {
            return read(in, base, configFile.toString());
        }
    }

    /**
     * @param base folder that relative paths are resolved against
     * @param origin name used in error messages
     */
    public AnalysisConfig read(InputStream in, Path base, String origin) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(base, "base must not be null");

        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new DataFormatException(origin, "configuration must be a JSON object");
        }

        String input = text(root, "input", null);
        if (input == null || input.isBlank()) {
            throw new DataFormatException(origin, "'input' is required");
        }
        AnalysisConfig d = AnalysisConfig.defaults(base.resolve(input));

        try {
            return new AnalysisConfig(
                    d.input(),
                    path(root, "normalizedOutput", base, d.normalizedOutput()),
                    path(root, "percentOutput", base, d.percentOutput()),
                    path(root, "pcScoresOutput", base, d.pcScoresOutput()),
                    root.path("harmonics").asInt(d.harmonics()),
                    text(root, "symbols", d.symbols()),
                    text(root, "speciesColumn", d.speciesColumn()),
                    text(root, "sexColumn", d.sexColumn()),
                    root.has("idColumn") && root.get("idColumn").isNull() ? null : text(root, "idColumn", d.idColumn()),
                    root.path("contourPoints").asInt(d.contourPoints()),
                    pcCounts(root, d.pcCounts(), origin),
                    coding(root, d.coding(), origin),
                    root.path("parallel").asBoolean(d.parallel())
            );
        } catch (IllegalArgumentException e) {
            if (e instanceof DataFormatException) throw e;
            throw new DataFormatException(origin, e.getMessage(), e);
        }
    }

    private static String text(JsonNode root, String field, String fallback) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? fallback : node.asText();
    }

    private static Path path(JsonNode root, String field, Path base, Path fallback) {
        String raw = text(root, field, null);
        return raw == null || raw.isBlank() ? fallback : base.resolve(raw);
    }

    private static List<Integer> pcCounts(JsonNode root, List<Integer> fallback, String origin) {
        JsonNode node = root.get("pcCounts");
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isArray()) {
            throw new DataFormatException(origin, "'pcCounts' must be an array of integers");
        }
        List<Integer> out = new ArrayList<>();
        for (JsonNode v : node) {
            if (!v.canConvertToInt()) {
                throw new DataFormatException(origin, "'pcCounts' must contain integers only");
            }
            out.add(v.asInt());
        }
        return out;
    }

    private static Coding coding(JsonNode root, Coding fallback, String origin) {
        String raw = text(root, "coding", null);
        if (raw == null) {
            return fallback;
        }
        try {
            return Coding.valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DataFormatException(origin, "unknown coding '" + raw + "'", e);
        }
    }
}
