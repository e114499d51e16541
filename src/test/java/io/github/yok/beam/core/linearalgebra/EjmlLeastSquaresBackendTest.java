package io.github.yok.beam.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.beam.core.linearalgebra.LeastSquaresBackend.LeastSquaresSolution;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class EjmlLeastSquaresBackendTest {

    private final EjmlLeastSquaresBackend backend = new EjmlLeastSquaresBackend();

    @Test
    void exactLineIsRecovered() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 0}, {1, 1}, {1, 2}, {1, 3}});
        double[] b = {1, 3, 5, 7};

        LeastSquaresSolution s = backend.solve(a, b);

        assertEquals(1.0, s.getCoefficients()[0], 1e-12);
        assertEquals(2.0, s.getCoefficients()[1], 1e-12);
        assertEquals(0.0, s.getResidualSumOfSquares(), 1e-20);
    }

    @Test
    void overdeterminedSystemReportsResidual() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1}, {1}, {1}, {1}});
        double[] b = {1, 2, 3, 4};

        LeastSquaresSolution s = backend.solve(a, b);

        assertEquals(2.5, s.getCoefficients()[0], 1e-12);
        assertEquals(5.0, s.getResidualSumOfSquares(), 1e-12);
        assertEquals(1.0, a.get(0, 0));
    }

    @Test
    void rankDeficientDesignIsRejected() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 2}, {2, 4}, {3, 6}});

        assertThrows(IllegalStateException.class, () -> backend.solve(a, new double[] {1, 2, 3}));
    }

    @Test
    void sizeMismatchIsRejected() {
        DMatrixRMaj a = new DMatrixRMaj(3, 2);

        assertThrows(IllegalArgumentException.class, () -> backend.solve(a, new double[2]));
        assertThrows(IllegalArgumentException.class,
                () -> backend.solve(new DMatrixRMaj(1, 2), new double[1]));
    }
}
