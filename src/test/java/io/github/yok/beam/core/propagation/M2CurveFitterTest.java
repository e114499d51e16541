package io.github.yok.beam.core.propagation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.beam.app.BeamProperties;
import io.github.yok.beam.core.error.FitConvergenceException;
import io.github.yok.beam.core.error.InsufficientDataException;
import io.github.yok.beam.core.linearalgebra.EjmlLeastSquaresBackend;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class M2CurveFitterTest {

    private static final double LAMBDA = 1e-3;

    private final M2CurveFitter fitter =
            new M2CurveFitter(new EjmlLeastSquaresBackend(), new BeamProperties.Fit());

    private static double divergence(double d0, double m2) {
        return 4.0 * LAMBDA * m2 / (Math.PI * d0);
    }

    private static List<PropagationSample> samples(double d0, double z0, double theta,
            double zFrom, double zTo, double step) {
        List<PropagationSample> list = new ArrayList<>();
        for (double z = zFrom; z <= zTo + 1e-9; z += step) {
            double dz = z - z0;
            list.add(new PropagationSample(z, Math.sqrt(d0 * d0 + theta * theta * dz * dz)));
        }
        return list;
    }

    @Test
    void recoversKnownBeam() {
        double theta = divergence(2.0, 1.5);
        List<PropagationSample> data = samples(2.0, 0.0, theta, -10000, 10000, 1000);

        M2FitResult r = fitter.fit(data, LAMBDA);

        assertEquals(2.0, r.getWaistDiameter(), 1e-6);
        assertEquals(1.0, r.getWaistRadius(), 1e-6);
        assertEquals(0.0, r.getWaistPosition(), 1e-3);
        assertEquals(theta, r.getFullDivergence(), 1e-9);
        assertEquals(1.5, r.getM2(), 1e-6);
        assertEquals(2.0 / theta, r.getRayleighRange(), 1e-3);
        assertTrue(r.getWarnings().isEmpty(), r.getWarnings().toString());
        assertTrue(r.isPhysicallyValid());
        assertEquals(18, r.getDiagnostics().getDegreesOfFreedom());
        assertEquals(5, r.getDiagnostics().getSamplesWithinRayleighRange());
        assertEquals(12, r.getDiagnostics().getSamplesBeyondTwoRayleighRanges());
    }

    @Test
    void derivedQuantitiesAreConsistent() {
        double theta = divergence(2.0, 1.5);
        M2FitResult r = fitter.fit(samples(2.0, 300.0, theta, -9700, 10300, 1000), LAMBDA);

        double w0 = r.getWaistRadius();
        double half = r.getHalfDivergence();
        assertEquals(300.0, r.getWaistPosition(), 1e-3);
        assertEquals(Math.PI * w0 * half / LAMBDA, r.getM2(), 1e-9);
        assertEquals(Math.PI * w0 * w0 / (r.getM2() * LAMBDA), r.getRayleighRange(), 1e-6);
        assertEquals(w0 * half, r.beamParameterProduct(), 1e-15);
        assertEquals(2.0, r.diameterAt(300.0), 1e-6);
        assertEquals(2.0 * Math.sqrt(2.0), r.diameterAt(300.0 + r.getRayleighRange()), 1e-6);
    }

    @Test
    void noisyDataGivesFiniteErrors() {
        double theta = divergence(2.0, 1.2);
        List<PropagationSample> data = samples(2.0, 0.0, theta, -10000, 10000, 500);
        List<PropagationSample> noisy = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            double jitter = ((i % 3) - 1) * 0.01;
            noisy.add(new PropagationSample(data.get(i).getZ(), data.get(i).getDiameter() + jitter));
        }

        M2FitResult r = fitter.fit(noisy, LAMBDA);

        assertEquals(1.2, r.getM2(), 0.05);
        FitDiagnostics d = r.getDiagnostics();
        assertTrue(d.getResidualSumOfSquares() > 0.0);
        assertTrue(Double.isFinite(d.getM2Error()) && d.getM2Error() > 0.0);
        assertTrue(Double.isFinite(d.getWaistDiameterError()));
        assertEquals(d.getWaistDiameterError() / 2.0, d.waistRadiusError(), 1e-15);
        assertEquals(3, d.getCovariance().length);
    }

    @Test
    void subDiffractionBeamIsFlaggedButReturned() {
        double theta = divergence(2.0, 0.5);

        M2FitResult r = fitter.fit(samples(2.0, 0.0, theta, -10000, 10000, 1000), LAMBDA);

        assertEquals(0.5, r.getM2(), 1e-6);
        assertTrue(r.getWarnings().contains(FitWarning.PHYSICALLY_INVALID));
        assertFalse(r.isPhysicallyValid());
    }

    @Test
    void threeSamplesFitExactlyWithoutErrorEstimates() {
        double theta = divergence(2.0, 1.5);

        M2FitResult r = fitter.fit(samples(2.0, 0.0, theta, -2000, 2000, 2000), LAMBDA);

        assertEquals(1.5, r.getM2(), 1e-6);
        assertEquals(0, r.getDiagnostics().getDegreesOfFreedom());
        assertTrue(Double.isNaN(r.getDiagnostics().getM2Error()));
        assertTrue(r.getWarnings().contains(FitWarning.ISO_SAMPLING));
    }

    @Test
    void tooFewPositionsAreRejected() {
        List<PropagationSample> two =
                List.of(new PropagationSample(0, 1), new PropagationSample(1, 2));
        assertThrows(InsufficientDataException.class, () -> fitter.fit(two, LAMBDA));

        List<PropagationSample> repeated = List.of(new PropagationSample(0, 1),
                new PropagationSample(0, 1.1), new PropagationSample(1, 2),
                new PropagationSample(1, 2.1));
        assertThrows(InsufficientDataException.class, () -> fitter.fit(repeated, LAMBDA));

        List<PropagationSample> signedZero = List.of(new PropagationSample(0.0, 1.0),
                new PropagationSample(-0.0, 1.0), new PropagationSample(1.0, 2.0));
        assertThrows(InsufficientDataException.class, () -> fitter.fit(signedZero, LAMBDA));
    }

    @Test
    void invalidInputsAreRejected() {
        List<PropagationSample> ok = samples(2.0, 0.0, 1e-3, -2000, 2000, 1000);
        assertThrows(IllegalArgumentException.class, () -> fitter.fit(ok, 0.0));
        assertThrows(NullPointerException.class, () -> fitter.fit(null, LAMBDA));

        List<PropagationSample> nan = new ArrayList<>(ok);
        nan.add(new PropagationSample(5000, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> fitter.fit(nan, LAMBDA));
    }

    @Test
    void evaluationBudgetExhaustionIsReported() {
        BeamProperties.Fit fit = new BeamProperties.Fit();
        fit.setMaxEvaluations(1);
        M2CurveFitter limited = new M2CurveFitter(new EjmlLeastSquaresBackend(), fit);
        // 下に凸でないデータ
        List<PropagationSample> concave = List.of(new PropagationSample(-2, 1),
                new PropagationSample(-1, 2), new PropagationSample(0, 3),
                new PropagationSample(1, 2), new PropagationSample(2, 1));

        assertThrows(FitConvergenceException.class, () -> limited.fit(concave, LAMBDA));
    }

    @Test
    void initialEstimateFallsBackForConcaveData() {
        List<PropagationSample> concave = List.of(new PropagationSample(-2, 1),
                new PropagationSample(-1, 2), new PropagationSample(0, 3),
                new PropagationSample(1, 2), new PropagationSample(2, 1));
        double[] z = {-2, -1, 0, 1, 2};
        double[] d2 = {1, 4, 9, 4, 1};

        double[] start = fitter.initialEstimate(concave, z, d2);

        assertEquals(1.0, start[0], 1e-12);
        assertEquals(-2.0, start[1], 1e-12);
        assertEquals(0.5, start[2], 1e-12);
    }

    @Test
    void invalidConfigurationIsRejected() {
        BeamProperties.Fit fit = new BeamProperties.Fit();
        fit.setMaxIterations(0);
        assertThrows(IllegalArgumentException.class,
                () -> new M2CurveFitter(new EjmlLeastSquaresBackend(), fit));
        assertThrows(IllegalArgumentException.class,
                () -> new M2CurveFitter(null, new BeamProperties.Fit()));
    }
}
