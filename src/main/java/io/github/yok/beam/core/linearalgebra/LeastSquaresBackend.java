package io.github.yok.beam.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 線形最小二乗 {@code min |A x - b|²} を解くバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LeastSquaresBackend {

    /**
     * 線形最小二乗問題を解きます。
     *
     * @param design 計画行列 A です（行数 ≥ 列数、入力は変更しません）
     * @param observed 観測値 b です（長さは A の行数）
     * @return 解と残差二乗和です
     * @throws IllegalStateException A がランク落ちしているなど、解けない場合に発生します
     */
    LeastSquaresSolution solve(DMatrixRMaj design, double[] observed);

    /**
     * 線形最小二乗の解を保持するクラスです。
     */
    @Value
    class LeastSquaresSolution {

        /**
         * 係数 x です。
         */
        double[] coefficients;

        /**
         * 残差二乗和 {@code |A x - b|²} です。
         */
        double residualSumOfSquares;
    }
}
