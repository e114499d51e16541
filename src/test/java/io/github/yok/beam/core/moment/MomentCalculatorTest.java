package io.github.yok.beam.core.moment;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.beam.core.error.DegenerateInputException;
import io.github.yok.beam.core.image.IntensityField;
import io.github.yok.beam.core.image.PixelRegion;
import io.github.yok.beam.core.image.TestBeamImageFactory;
import org.junit.jupiter.api.Test;

class MomentCalculatorTest {

    private final MomentCalculator calculator = new MomentCalculator();

    @Test
    void circularGaussianMoments() {
        // d = 80 (σ = 20)
        IntensityField f = TestBeamImageFactory.create(301, 301, 150, 140, 80, 80, 0, 1.0);

        MomentSet m = calculator.compute(f, null);

        assertEquals(150.0, m.getXc(), 1e-9);
        assertEquals(140.0, m.getYc(), 1e-9);
        assertEquals(400.0, m.getVarX(), 1e-4);
        assertEquals(400.0, m.getVarY(), 1e-4);
        assertEquals(0.0, m.getCovXY(), 1e-6);
        assertEquals(301L * 301L, m.getPixelCount());
    }

    @Test
    void twoPointMoments() {
        double[][] rows = new double[3][5];
        rows[1][0] = 1.0;
        rows[1][4] = 3.0;

        MomentSet m = calculator.compute(IntensityField.fromRows(rows), null);

        assertEquals(4.0, m.getTotalIntensity());
        assertEquals(3.0, m.getXc(), 1e-12);
        assertEquals(1.0, m.getYc(), 1e-12);
        // (1 * 9 + 3 * 1) / 4
        assertEquals(3.0, m.getVarX(), 1e-12);
        assertEquals(0.0, m.getVarY(), 1e-12);
    }

    @Test
    void regionRestrictsSummation() {
        double[][] rows = new double[3][5];
        rows[1][0] = 1.0;
        rows[1][4] = 3.0;

        MomentSet m = calculator.compute(IntensityField.fromRows(rows), new PixelRegion(2, 0, 5, 3));

        assertEquals(3.0, m.getTotalIntensity());
        assertEquals(4.0, m.getXc(), 1e-12);
        assertEquals(0.0, m.getVarX(), 1e-12);
        assertEquals(9L, m.getPixelCount());
    }

    @Test
    void maskRestrictsSummation() {
        double[][] rows = new double[3][5];
        rows[1][0] = 1.0;
        rows[1][4] = 3.0;
        PixelMask leftOnly = new PixelMask() {
            @Override
            public boolean contains(int x, int y) {
                return x < 2;
            }

            @Override
            public PixelRegion bounds() {
                return new PixelRegion(-10, -10, 10, 10);
            }
        };

        MomentSet m = calculator.compute(IntensityField.fromRows(rows), null, leftOnly);

        assertEquals(1.0, m.getTotalIntensity());
        assertEquals(0.0, m.getXc(), 1e-12);
    }

    @Test
    void allZeroFieldIsDegenerate() {
        assertThrows(DegenerateInputException.class,
                () -> calculator.compute(IntensityField.zeros(16, 16), null));
    }

    @Test
    void emptyRegionIsDegenerate() {
        IntensityField f = TestBeamImageFactory.create(32, 32, 16, 16, 8, 8, 0, 1.0);
        assertThrows(DegenerateInputException.class,
                () -> calculator.compute(f, new PixelRegion(100, 100, 120, 120)));
    }

    @Test
    void inputIsNotModified() {
        IntensityField f = TestBeamImageFactory.create(64, 48, 30, 20, 20, 10, 0.3, 1.0);
        double[] before = f.toArray();

        calculator.compute(f, null);

        assertArrayEquals(before, f.toArray());
    }
}
