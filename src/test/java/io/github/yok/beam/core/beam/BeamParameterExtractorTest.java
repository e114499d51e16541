package io.github.yok.beam.core.beam;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.beam.core.beam.BeamParameterExtractor.Extraction;
import io.github.yok.beam.core.image.IntensityField;
import io.github.yok.beam.core.image.TestBeamImageFactory;
import io.github.yok.beam.core.moment.MomentCalculator;
import io.github.yok.beam.core.moment.MomentSet;
import org.junit.jupiter.api.Test;

class BeamParameterExtractorTest {

    private final MomentCalculator calculator = new MomentCalculator();

    private final BeamParameterExtractor extractor = new BeamParameterExtractor();

    @Test
    void circularGaussianDiameterIsFourSigma() {
        IntensityField f = TestBeamImageFactory.create(301, 301, 150, 150, 80, 80, 0, 1.0);

        Extraction e = extractor.extract(calculator.compute(f, null));
        BeamParameters p = e.getParameters();

        assertEquals(150.0, p.getXc(), 1e-9);
        assertEquals(150.0, p.getYc(), 1e-9);
        assertEquals(80.0, p.getDMajor(), 1e-4);
        assertEquals(80.0, p.getDMinor(), 1e-4);
        assertEquals(1.0, p.ellipticity(), 1e-6);
        assertFalse(e.isClamped());
    }

    @Test
    void rotatedEllipseAngleIsRecovered() {
        double phi0 = Math.PI / 6;
        IntensityField f = TestBeamImageFactory.create(301, 301, 150, 150, 80, 40, phi0, 1.0);

        BeamParameters p = extractor.extract(calculator.compute(f, null)).getParameters();

        assertEquals(80.0, p.getDMajor(), 1e-3);
        assertEquals(40.0, p.getDMinor(), 1e-3);
        assertEquals(phi0, p.getPhi(), 1e-6);
        assertEquals(0.5, p.ellipticity(), 1e-4);
    }

    @Test
    void negativeAngleIsRecovered() {
        double phi0 = -Math.PI / 3;
        IntensityField f = TestBeamImageFactory.create(301, 301, 150, 150, 60, 30, phi0, 1.0);

        BeamParameters p = extractor.extract(calculator.compute(f, null)).getParameters();

        assertEquals(phi0, p.getPhi(), 1e-6);
    }

    @Test
    void angleIsInHalfOpenRange() {
        // 長軸が y 方向：φ = -π/2（π/2 ではない）
        MomentSet m = new MomentSet(1.0, 0.0, 0.0, 1.0, 4.0, 0.0, 1);

        BeamParameters p = extractor.extract(m).getParameters();

        assertEquals(-Math.PI / 2, p.getPhi(), 1e-12);
        assertEquals(8.0, p.getDMajor(), 1e-12);
        assertEquals(4.0, p.getDMinor(), 1e-12);
    }

    @Test
    void nonPositiveSemidefiniteCovarianceIsClamped() {
        // λ = 1 ± 2
        MomentSet m = new MomentSet(1.0, 3.0, 4.0, 1.0, 1.0, 2.0, 1);

        Extraction e = extractor.extract(m);

        assertTrue(e.isClamped());
        assertEquals(0.0, e.getParameters().getDMinor());
        assertEquals(4.0 * Math.sqrt(3.0), e.getParameters().getDMajor(), 1e-12);
        assertEquals(Math.PI / 4, e.getParameters().getPhi(), 1e-12);
        assertEquals(0.0, e.getParameters().ellipticity());
    }

    @Test
    void fixedAngleAlongMinorAxisReportsSortedDiameters() {
        MomentSet m = new MomentSet(1.0, 0.0, 0.0, 16.0, 4.0, 0.0, 1);

        BeamParameters p = extractor.extract(m, Math.PI / 2).getParameters();

        assertEquals(16.0, p.getDMajor(), 1e-12);
        assertEquals(8.0, p.getDMinor(), 1e-12);
        assertEquals(-Math.PI / 2, p.getPhi(), 1e-12);
    }

    @Test
    void fixedAngleAtFortyFiveDegreesAveragesVariances() {
        MomentSet m = new MomentSet(1.0, 0.0, 0.0, 16.0, 4.0, 0.0, 1);

        BeamParameters p = extractor.extract(m, Math.PI / 4).getParameters();

        assertEquals(4.0 * Math.sqrt(10.0), p.getDMajor(), 1e-12);
        assertEquals(4.0 * Math.sqrt(10.0), p.getDMinor(), 1e-12);
    }

    @Test
    void normalizeAngleWrapsByPi() {
        assertEquals(-Math.PI / 4, BeamParameterExtractor.normalizeAngle(3 * Math.PI / 4), 1e-12);
        assertEquals(-Math.PI / 2, BeamParameterExtractor.normalizeAngle(Math.PI / 2), 1e-12);
        assertEquals(0.0, BeamParameterExtractor.normalizeAngle(Math.PI), 1e-12);
        assertEquals(Math.PI / 3, BeamParameterExtractor.normalizeAngle(Math.PI / 3), 1e-12);
    }

    @Test
    void scalingConvertsLengthsOnly() {
        BeamParameters p = new BeamParameters(10, 20, 8, 4, 0.25).scaled(0.5);

        assertEquals(5.0, p.getXc());
        assertEquals(10.0, p.getYc());
        assertEquals(4.0, p.getDMajor());
        assertEquals(2.0, p.getDMinor());
        assertEquals(0.25, p.getPhi());
    }
}
