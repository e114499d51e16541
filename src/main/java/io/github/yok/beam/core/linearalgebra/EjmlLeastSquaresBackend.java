package io.github.yok.beam.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * EJML を用いて、線形最小二乗問題を QR 分解で解くクラスです。
 */
public final class EjmlLeastSquaresBackend implements LeastSquaresBackend {

    /**
     * 条件数が悪すぎると判断する quality の下限です。
     */
    private static final double MIN_QUALITY = 1e-14;

    /**
     * 線形最小二乗問題を解きます。
     *
     * @param design 計画行列 A です（行数 ≥ 列数、入力は変更しません）
     * @param observed 観測値 b です（長さは A の行数）
     * @return 解と残差二乗和です
     * @throws IllegalArgumentException 引数が null、またはサイズ不整合の場合に発生します
     * @throws IllegalStateException A がランク落ちしている場合に発生します
     */
    @Override
    public LeastSquaresSolution solve(DMatrixRMaj design, double[] observed) {
        if (design == null) {
            throw new IllegalArgumentException("design は null 不可です");
        }
        if (observed == null) {
            throw new IllegalArgumentException("observed は null 不可です");
        }
        int rows = design.numRows;
        int cols = design.numCols;
        if (observed.length != rows) {
            throw new IllegalArgumentException(
                    "observed の長さが design の行数と一致しません: " + observed.length + " vs " + rows);
        }
        if (rows < cols) {
            throw new IllegalArgumentException("design の行数が列数より少ないです: " + rows + "x" + cols);
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(rows, cols);

        // ソルバが A を書き換える場合があるため複製を渡します。
        DMatrixRMaj a = design.copy();
        if (!solver.setA(a)) {
            throw new IllegalStateException("最小二乗ソルバの初期化に失敗しました（EJML）");
        }
        if (solver.quality() < MIN_QUALITY) {
            throw new IllegalStateException("計画行列がランク落ちしています: quality=" + solver.quality());
        }

        DMatrixRMaj b = new DMatrixRMaj(rows, 1, true, observed);
        DMatrixRMaj x = new DMatrixRMaj(cols, 1);
        solver.solve(b, x);

        // 残差 r = A x - b
        DMatrixRMaj fitted = new DMatrixRMaj(rows, 1);
        CommonOps_DDRM.mult(design, x, fitted);
        double rss = 0.0;
        for (int i = 0; i < rows; i++) {
            double r = fitted.get(i, 0) - observed[i];
            rss += r * r;
        }

        double[] coefficients = new double[cols];
        for (int j = 0; j < cols; j++) {
            coefficients[j] = x.get(j, 0);
        }
        return new LeastSquaresSolution(coefficients, rss);
    }
}
