package io.github.yok.beam.core.propagation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.beam.app.BeamProperties;
import io.github.yok.beam.core.beam.BeamMeasurer;
import io.github.yok.beam.core.beam.BeamParameterExtractor;
import io.github.yok.beam.core.beam.BeamParameters;
import io.github.yok.beam.core.image.IntensityField;
import io.github.yok.beam.core.image.TestBeamImageFactory;
import io.github.yok.beam.core.linearalgebra.EjmlLeastSquaresBackend;
import io.github.yok.beam.core.mask.MaskRefiner;
import io.github.yok.beam.core.moment.MomentCalculator;
import io.github.yok.beam.core.propagation.CausticAnalyzer.AxisFits;
import io.github.yok.beam.core.propagation.CausticAnalyzer.CausticResult;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CausticAnalyzerTest {

    private static final double PIXEL = 0.005;

    private static final double LAMBDA = 0.001;

    private CausticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        MomentCalculator calculator = new MomentCalculator();
        BeamParameterExtractor extractor = new BeamParameterExtractor();
        BeamMeasurer measurer = new BeamMeasurer(calculator, extractor,
                new MaskRefiner(calculator, extractor, new BeamProperties.Mask()));
        M2CurveFitter fitter =
                new M2CurveFitter(new EjmlLeastSquaresBackend(), new BeamProperties.Fit());
        analyzer = new CausticAnalyzer(measurer, fitter, PIXEL);
    }

    private static double diameter(double d0, double theta, double z) {
        return Math.sqrt(d0 * d0 + theta * theta * z * z);
    }

    @Test
    void astigmaticBeamGivesPerAxisM2() {
        double theta = 4.0 * LAMBDA * 1.5 / (Math.PI * 0.3);
        List<Double> positions = new ArrayList<>();
        List<IntensityField> images = new ArrayList<>();
        for (int z = -60; z <= 60; z += 10) {
            double dMajor = diameter(0.3, theta, z) / PIXEL;
            double dMinor = diameter(0.2, theta, z) / PIXEL;
            positions.add((double) z);
            images.add(TestBeamImageFactory.create(301, 301, 150, 150, dMajor, dMinor, 0, 1.0));
        }

        CausticResult r = analyzer.analyze(positions, images, LAMBDA);

        assertEquals(13, r.getMeasurements().size());
        assertEquals(1.5, r.getMajor().getM2(), 1.5 * 0.02);
        assertEquals(1.0, r.getMinor().getM2(), 0.02);
        assertEquals(0.3, r.getMajor().getWaistDiameter(), 0.3 * 0.02);
        assertEquals(0.0, r.getMajor().getWaistPosition(), 0.5);
        assertEquals(0.0, r.getMinor().getWaistPosition(), 0.5);
    }

    @Test
    void fitAxesSplitsMajorAndMinor() {
        double thetaMajor = 4.0 * LAMBDA * 2.0 / (Math.PI * 0.4);
        double thetaMinor = 4.0 * LAMBDA * 1.2 / (Math.PI * 0.25);
        List<Double> positions = new ArrayList<>();
        List<BeamParameters> params = new ArrayList<>();
        for (int z = -500; z <= 500; z += 50) {
            positions.add((double) z);
            params.add(new BeamParameters(0, 0, diameter(0.4, thetaMajor, z),
                    diameter(0.25, thetaMinor, z), 0));
        }

        AxisFits fits = analyzer.fitAxes(positions, params, LAMBDA);

        assertEquals(2.0, fits.getMajor().getM2(), 1e-6);
        assertEquals(1.2, fits.getMinor().getM2(), 1e-6);
    }

    @Test
    void mismatchedInputsAreRejected() {
        List<Double> positions = List.of(0.0, 1.0);
        List<IntensityField> images = List.of(IntensityField.zeros(3, 3));

        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(positions, images, LAMBDA));
    }

    @Test
    void invalidConstructionIsRejected() {
        MomentCalculator calculator = new MomentCalculator();
        BeamParameterExtractor extractor = new BeamParameterExtractor();
        BeamMeasurer measurer = new BeamMeasurer(calculator, extractor,
                new MaskRefiner(calculator, extractor, new BeamProperties.Mask()));
        M2CurveFitter fitter =
                new M2CurveFitter(new EjmlLeastSquaresBackend(), new BeamProperties.Fit());

        assertThrows(IllegalArgumentException.class, () -> new CausticAnalyzer(null, fitter, PIXEL));
        assertThrows(IllegalArgumentException.class,
                () -> new CausticAnalyzer(measurer, null, PIXEL));
        assertThrows(IllegalArgumentException.class, () -> new CausticAnalyzer(measurer, fitter, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new CausticAnalyzer(measurer, fitter, Double.NaN));
    }

    @Test
    void nonPositivePixelSizeIsRejected() {
        List<Double> positions = List.of(0.0);
        List<IntensityField> images = List.of(IntensityField.zeros(3, 3));

        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(positions, images, -1.0, LAMBDA));
    }
}
