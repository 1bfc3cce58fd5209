package org.wingshape.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WingShapeCliTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private Path fixture() throws IOException {
        Path input = tmp.resolve("four_specimens_h1.csv");
        try (InputStream in = WingShapeCliTest.class.getResourceAsStream("/four_specimens_h1.csv")) {
            assertNotNull(in);
            Files.copy(in, input);
        }
        return input;
    }

    @Test
    void noArguments_isUsageError() {
        assertEquals(WingShapeCli.USAGE_ERROR, WingShapeCli.run(new String[0], out));
        assertTrue(output().startsWith("Usage:"));
    }

    @Test
    void missingFile_isUsageError() {
        assertEquals(WingShapeCli.USAGE_ERROR, WingShapeCli.run(new String[]{tmp.resolve("nope.csv").toString()}, out));
    }

    @Test
    void csvWithDefaults_missingHarmonicColumns_isDataError() throws IOException {
        // defaults expect ten harmonics, the fixture carries one
        int code = WingShapeCli.run(new String[]{fixture().toString()}, out);

        assertEquals(WingShapeCli.DATA_ERROR, code);
        assertTrue(output().contains("a2"), output());
    }

    @Test
    void jsonConfig_runsPipeline() throws IOException {
        fixture();
        Path config = tmp.resolve("run.json");
        Files.writeString(config, """
                { "input": "four_specimens_h1.csv", "harmonics": 1, "pcCounts": [2], "percentOutput": "pct.csv" }
                """);

        int code = WingShapeCli.run(new String[]{config.toString()}, out);

        assertEquals(WingShapeCli.OK, code, output());
        assertTrue(Files.isRegularFile(tmp.resolve("pct.csv")));
        assertTrue(Files.isRegularFile(tmp.resolve("pct.json")));
        assertTrue(Files.isRegularFile(tmp.resolve("normalized_efd_coefficients.csv")));
        assertTrue(output().contains("All Features (4)"), output());
    }

    @Test
    void invalidJsonConfig_isDataError() throws IOException {
        Path config = tmp.resolve("bad.json");
        Files.writeString(config, "{ \"harmonics\": 1 }");

        assertEquals(WingShapeCli.DATA_ERROR, WingShapeCli.run(new String[]{config.toString()}, out));
    }
}
