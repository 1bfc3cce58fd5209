package org.wingshape.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wingshape.diagnostics.DataFormatException;
import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.diagnostics.NumericCondition;
import org.wingshape.model.CoefficientLayout;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.HarmonicCoefficients;
import org.wingshape.model.Specimen;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SizeNormalizerTest {

    private static final CoefficientLayout H10 = CoefficientLayout.ofHarmonics(10);

    private final SizeNormalizer normalizer = new SizeNormalizer();

    private static Specimen randomSpecimen(String id, long seed) {
        Random rnd = new Random(seed);
        double[] values = new double[H10.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = rnd.nextGaussian() * (i % 10 == 0 ? 5.0 : 0.5);
        }
        return new Specimen(id, "Chrysomya megacephala", "female", new HarmonicCoefficients(H10, values));
    }

    private static void assertRelativelyEqual(double[] expected, double[] actual, double tol) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            double scale = Math.max(1.0, Math.abs(expected[i]));
            assertEquals(expected[i], actual[i], tol * scale, "component " + i);
        }
    }

    @Test
    void diagonalFirstHarmonic_dividesByLargerAxis() {
        HarmonicCoefficients c = new HarmonicCoefficients(CoefficientLayout.ofHarmonics(1), new double[]{2, 0, 0, 1});
        NormalizationResult r = normalizer.normalize(new Specimen("s", "A", "female", c));

        assertEquals(2.0, r.semiMajorAxis(), 1e-12);
        assertArrayEquals(new double[]{1.0, 0.0, 0.0, 0.5}, r.specimen().coefficients().toArrayCopy(), 1e-12);
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void rotatedEllipse_usesLargestEigenvalue() {
        // T = [[3, 4], [0, 0]] -> M = [[25, 0], [0, 0]] -> p = 5
        HarmonicCoefficients c = new HarmonicCoefficients(CoefficientLayout.ofHarmonics(1), new double[]{3, 4, 0, 0});
        NormalizationResult r = normalizer.normalize(new Specimen("s", "A", "male", c));
        assertEquals(5.0, r.semiMajorAxis(), 1e-12);
        assertArrayEquals(new double[]{0.6, 0.8, 0.0, 0.0}, r.specimen().coefficients().toArrayCopy(), 1e-12);
    }

    @Test
    @DisplayName("normalize(k * S) equals normalize(S) for k > 0")
    void scaleInvariance() {
        for (long seed = 1; seed <= 20; seed++) {
            Specimen s = randomSpecimen("s" + seed, seed);
            double[] base = normalizer.normalize(s).specimen().coefficients().toArrayCopy();

            for (double k : new double[]{1e-3, 0.37, 2.0, 13.5, 4.2e4}) {
                Specimen scaled = s.withCoefficients(s.coefficients().scaled(k));
                double[] out = normalizer.normalize(scaled).specimen().coefficients().toArrayCopy();
                assertRelativelyEqual(base, out, 1e-9);
            }
        }
    }

    @Test
    @DisplayName("extreme magnitudes neither overflow nor underflow the first-harmonic matrix")
    void scaleInvariance_atExtremeMagnitudes() {
        CoefficientLayout h1 = CoefficientLayout.ofHarmonics(1);
        for (double k : new double[]{1e160, 1e-170, 1e300, 4.9e-320}) {
            HarmonicCoefficients c = new HarmonicCoefficients(h1, new double[]{2 * k, 0, 0, k});
            NormalizationResult r = normalizer.normalize(new Specimen("k=" + k, "A", "female", c));

            assertEquals(2 * k, r.semiMajorAxis(), 2 * k * 1e-12, "k=" + k);
            assertArrayEquals(new double[]{1.0, 0.0, 0.0, 0.5}, r.specimen().coefficients().toArrayCopy(), 1e-12);
            assertTrue(r.diagnostics().isEmpty(), "k=" + k + ": " + r.diagnostics());
        }
    }

    @Test
    void scaleInvariance_atExtremeMagnitudes_rotatedEllipse() {
        Specimen s = randomSpecimen("s", 7L);
        double[] base = normalizer.normalize(s).specimen().coefficients().toArrayCopy();
        for (double k : new double[]{1e160, 1e-170}) {
            double[] out = normalizer.normalize(s.withCoefficients(s.coefficients().scaled(k)))
                    .specimen().coefficients().toArrayCopy();
            assertRelativelyEqual(base, out, 1e-9);
        }
    }

    @Test
    void negativeEigenvalue_usesAbsoluteValue_andIsRecorded() {
        List<Diagnostic> diagnostics = new ArrayList<>();

        double p = SizeNormalizer.axisFromEigenvalue("W-7", -4.0, 3.0, diagnostics);

        assertEquals(6.0, p, 1e-12);
        assertEquals(1, diagnostics.size());
        assertEquals(NumericCondition.NEGATIVE_EIGENVALUE, diagnostics.get(0).condition());
        assertEquals("W-7", diagnostics.get(0).subject());
    }

    @Test
    void zeroEigenvalue_fallsBackToOne() {
        List<Diagnostic> diagnostics = new ArrayList<>();

        assertEquals(1.0, SizeNormalizer.axisFromEigenvalue("W-8", 0.0, 5.0, diagnostics));
        assertEquals(List.of(NumericCondition.DEGENERATE_GEOMETRY),
                diagnostics.stream().map(Diagnostic::condition).toList());
    }

    @Test
    @DisplayName("normalizing twice changes nothing; the second pass sees p = 1")
    void idempotence() {
        Specimen s = randomSpecimen("s", 42L);
        NormalizationResult once = normalizer.normalize(s);
        NormalizationResult twice = normalizer.normalize(once.specimen());

        assertEquals(1.0, twice.semiMajorAxis(), 1e-12);
        assertRelativelyEqual(
                once.specimen().coefficients().toArrayCopy(),
                twice.specimen().coefficients().toArrayCopy(),
                1e-12);
    }

    @Test
    void zeroFirstHarmonic_substitutesOne_andFlagsDegenerateGeometry() {
        double[] values = new double[H10.size()];
        // higher harmonics present, first harmonic zero
        values[H10.indexOf("a2")] = 0.3;
        values[H10.indexOf("d5")] = -0.1;
        Specimen s = new Specimen("flat", "Lucilia sericata", "male", new HarmonicCoefficients(H10, values));

        NormalizationResult r = normalizer.normalize(s);

        assertEquals(1.0, r.semiMajorAxis());
        assertArrayEquals(values, r.specimen().coefficients().toArrayCopy());
        assertEquals(1, r.diagnostics().size());
        assertEquals(NumericCondition.DEGENERATE_GEOMETRY, r.diagnostics().get(0).condition());
        assertEquals("flat", r.diagnostics().get(0).subject());
    }

    @Test
    void allZeroSpecimen_staysZero() {
        Specimen s = new Specimen("zero", "A", "female", new HarmonicCoefficients(H10, new double[H10.size()]));
        NormalizationResult r = normalizer.normalize(s);
        for (double v : r.specimen().coefficients().toArrayCopy()) {
            assertEquals(0.0, v);
            assertFalse(Double.isNaN(v));
        }
    }

    @Test
    void nonFiniteFirstHarmonic_isDataFormatError_namingSpecimen() {
        double[] values = new double[H10.size()];
        values[H10.indexOf("b1")] = Double.NaN;
        Specimen s = new Specimen("W-0031", "A", "female", new HarmonicCoefficients(H10, values));

        DataFormatException ex = assertThrows(DataFormatException.class, () -> normalizer.normalize(s));
        assertTrue(ex.getMessage().contains("W-0031"));
    }

    @Test
    void normalizeAll_keepsOrderAndMetadata_andLeavesInputUntouched() {
        List<Specimen> specimens = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            specimens.add(randomSpecimen("s" + i, 100 + i));
        }
        CoefficientStore input = new CoefficientStore(specimens);
        double before = input.get(3).coefficients().a(1);

        NormalizedDataset serial = new SizeNormalizer(false).normalizeAll(input);
        NormalizedDataset parallel = new SizeNormalizer(true).normalizeAll(input);

        assertEquals(input.size(), serial.store().size());
        assertEquals(List.copyOf(input.ids()), List.copyOf(serial.store().ids()));
        assertEquals(input.speciesLabels(), serial.store().speciesLabels());
        assertEquals(before, input.get(3).coefficients().a(1));
        for (int i = 0; i < input.size(); i++) {
            assertArrayEquals(serial.store().matrix().row(i), parallel.store().matrix().row(i));
            assertEquals(serial.semiMajorAxis(i), parallel.semiMajorAxis(i));
            assertTrue(serial.semiMajorAxis(i) > 0.0);
        }
    }
}
