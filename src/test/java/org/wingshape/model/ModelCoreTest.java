package org.wingshape.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for:
 * - Vector
 * - CoefficientLayout
 * - HarmonicCoefficients
 * - CoefficientMatrix
 * - CoefficientStore
 */
public class ModelCoreTest {

    // ----------------------------
    // Helpers
    // ----------------------------

    private static final CoefficientLayout H2 = CoefficientLayout.ofHarmonics(2);

    /** a1 a2 b1 b2 c1 c2 d1 d2 */
    private static HarmonicCoefficients h2(double... values) {
        return new HarmonicCoefficients(H2, values);
    }

    private static Specimen specimen(String id, String species, String sex, double... values) {
        return new Specimen(id, species, sex, h2(values));
    }

    @Nested
    class VectorTests {

        @Test
        void constructor_copiesInput() {
            double[] raw = {1.0, 2.0};
            Vector v = new Vector(raw);
            raw[0] = 99.0;
            assertEquals(1.0, v.get(0));
        }

        @Test
        void constructor_rejectsNullAndEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new Vector(null));
            assertThrows(IllegalArgumentException.class, () -> new Vector(new double[0]));
        }

        @Test
        void scale_isComponentWise() {
            Vector a = new Vector(new double[]{1.0, -2.0});
            assertArrayEquals(new double[]{0.5, -1.0}, a.scale(0.5).toArrayCopy());
            assertArrayEquals(new double[]{1.0, -2.0}, a.toArrayCopy());
        }

        @Test
        void average_dimensionMismatch_throws() {
            assertThrows(IllegalArgumentException.class, () -> Vector.average(List.of(
                    new Vector(new double[]{1.0, 2.0}),
                    new Vector(new double[]{1.0}))));
            assertThrows(IllegalArgumentException.class, () -> Vector.average(List.of()));
        }

        @Test
        void average_ofThree() {
            Vector avg = Vector.average(List.of(
                    new Vector(new double[]{0.0, 3.0}),
                    new Vector(new double[]{3.0, 3.0}),
                    new Vector(new double[]{6.0, 0.0})
            ));
            assertArrayEquals(new double[]{3.0, 2.0}, avg.toArrayCopy(), 1e-12);
        }
    }

    @Nested
    class LayoutTests {

        @Test
        void columnNames_areSymbolMajor() {
            assertEquals(List.of("a1", "a2", "b1", "b2", "c1", "c2", "d1", "d2"), H2.columnNames());
        }

        @Test
        void indexOf_roundTripsWithColumnName() {
            CoefficientLayout h10 = CoefficientLayout.ofHarmonics(10);
            assertEquals(40, h10.size());
            assertEquals(0, h10.indexOf("a1"));
            assertEquals(9, h10.indexOf("a10"));
            assertEquals(39, h10.indexOf("d10"));
            assertEquals("c7", h10.columnName(h10.indexOf("c7")));
        }

        @Test
        void indexOf_unknownColumn_isMinusOne() {
            assertEquals(-1, H2.indexOf("a3"));
            assertEquals(-1, H2.indexOf("e1"));
            assertEquals(-1, H2.indexOf("a01"));
            assertEquals(-1, H2.indexOf("species"));
            assertEquals(-1, H2.indexOf("a"));
        }

        @Test
        void customSymbols() {
            CoefficientLayout upper = new CoefficientLayout(1, "ABCD");
            assertEquals(List.of("A1", "B1", "C1", "D1"), upper.columnNames());
            assertEquals(3, upper.indexOf("D1"));
        }

        @Test
        void invalidLayouts_throw() {
            assertThrows(IllegalArgumentException.class, () -> new CoefficientLayout(0, "abcd"));
            assertThrows(IllegalArgumentException.class, () -> new CoefficientLayout(1, "abc"));
            assertThrows(IllegalArgumentException.class, () -> new CoefficientLayout(1, "aacd"));
        }
    }

    @Nested
    class HarmonicCoefficientsTests {

        @Test
        void accessors_followLayout() {
            HarmonicCoefficients c = h2(1, 2, 3, 4, 5, 6, 7, 8);
            assertEquals(1, c.a(1));
            assertEquals(2, c.a(2));
            assertEquals(3, c.b(1));
            assertEquals(6, c.c(2));
            assertEquals(8, c.d(2));
        }

        @Test
        void wrongLength_throws() {
            assertThrows(IllegalArgumentException.class, () -> new HarmonicCoefficients(H2, new double[]{1, 2, 3, 4}));
        }

        @Test
        void harmonicOutOfRange_throws() {
            HarmonicCoefficients c = h2(1, 2, 3, 4, 5, 6, 7, 8);
            assertThrows(IndexOutOfBoundsException.class, () -> c.a(3));
            assertThrows(IndexOutOfBoundsException.class, () -> c.d(0));
        }

        @Test
        void scaledAndDivided_leaveOriginalUntouched() {
            HarmonicCoefficients c = h2(1, 2, 3, 4, 5, 6, 7, 8);
            assertEquals(4.0, c.scaled(2.0).b(2));
            assertEquals(0.5, c.divided(2.0).a(1));
            assertEquals(1.0, c.a(1));
        }

        @Test
        void dividedByZero_throws() {
            assertThrows(IllegalArgumentException.class, () -> h2(1, 2, 3, 4, 5, 6, 7, 8).divided(0.0));
        }
    }

    @Nested
    class StoreTests {

        private CoefficientStore store() {
            return new CoefficientStore(List.of(
                    specimen("s1", "Lucilia sericata", "female", 1, 0, 0, 0, 0, 0, 1, 0),
                    specimen("s2", "Calliphora vicina", "male", 2, 0, 0, 0, 0, 0, 2, 0),
                    specimen("s3", "Lucilia sericata", "female", 3, 0, 0, 0, 0, 0, 3, 0),
                    specimen("s4", "Lucilia sericata", "male", 4, 0, 0, 0, 0, 0, 4, 0)
            ));
        }

        @Test
        void preservesRowOrder() {
            CoefficientStore s = store();
            assertEquals(List.of("s1", "s2", "s3", "s4"), List.copyOf(s.ids()));
            assertEquals("s3", s.get(2).id());
            assertEquals(List.of("Lucilia sericata", "Calliphora vicina", "Lucilia sericata", "Lucilia sericata"),
                    s.speciesLabels());
            assertEquals(List.of("female", "male", "female", "male"), s.sexLabels());
        }

        @Test
        void matrix_isColumnar() {
            CoefficientMatrix m = store().matrix();
            assertEquals(4, m.rows());
            assertEquals(8, m.cols());
            assertArrayEquals(new double[]{1, 2, 3, 4}, m.column("a1"));
            assertArrayEquals(new double[]{3, 0, 0, 0, 0, 0, 3, 0}, m.row(2));
            assertEquals(4.0, m.toArray()[3][6]);
        }

        @Test
        void groups_inFirstAppearanceOrder() {
            Map<GroupKey, List<Specimen>> groups = store().groups();
            assertEquals(List.of(
                    new GroupKey("Lucilia sericata", "female"),
                    new GroupKey("Calliphora vicina", "male"),
                    new GroupKey("Lucilia sericata", "male")
            ), List.copyOf(groups.keySet()));
            assertEquals(2, groups.get(new GroupKey("Lucilia sericata", "female")).size());
        }

        @Test
        void duplicateIds_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new CoefficientStore(List.of(
                    specimen("dup", "A", "female", 1, 0, 0, 0, 0, 0, 1, 0),
                    specimen("dup", "B", "male", 1, 0, 0, 0, 0, 0, 1, 0)
            )));
        }

        @Test
        void mixedLayouts_rejected() {
            Specimen h1 = new Specimen("x", "A", "female",
                    new HarmonicCoefficients(CoefficientLayout.ofHarmonics(1), new double[]{1, 0, 0, 1}));
            assertThrows(IllegalArgumentException.class, () -> new CoefficientStore(List.of(
                    specimen("s1", "A", "female", 1, 0, 0, 0, 0, 0, 1, 0), h1
            )));
        }

        @Test
        void empty_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new CoefficientStore(List.of()));
        }

        @Test
        void require_unknownId_throws() {
            assertThrows(IllegalArgumentException.class, () -> store().require("nope"));
            assertTrue(store().find("nope").isEmpty());
        }

        @Test
        void withCoefficients_returnsNewStore_originalUnchanged() {
            CoefficientStore original = store();
            List<HarmonicCoefficients> halved = original.specimens().stream()
                    .map(s -> s.coefficients().divided(2.0))
                    .toList();

            CoefficientStore copy = original.withCoefficients(halved);

            assertEquals(0.5, copy.require("s1").coefficients().a(1));
            assertEquals(1.0, original.require("s1").coefficients().a(1));
            assertEquals(original.speciesLabels(), copy.speciesLabels());
        }

        @Test
        void specimen_blankMetadata_rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> specimen("s", " ", "female", 1, 0, 0, 0, 0, 0, 1, 0));
            assertThrows(IllegalArgumentException.class,
                    () -> specimen("s", "A", "", 1, 0, 0, 0, 0, 0, 1, 0));
        }
    }
}
