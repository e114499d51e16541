package io.github.yok.beam.core.propagation;

import lombok.Value;

/**
 * M² フィットの診断情報（残差・共分散・標準誤差）を保持するクラスです。
 *
 * <p>
 * 共分散と標準誤差は {@code s² (JᵀJ)⁻¹}（{@code s² = RSS / (n - 3)}）から求めます。 自由度が 0 の場合は NaN です。
 * </p>
 */
@Value
public class FitDiagnostics {

    /**
     * d² の残差二乗和です。
     */
    double residualSumOfSquares;

    /**
     * 自由度（サンプル数 - 3）です。
     */
    int degreesOfFreedom;

    /**
     * 最適化の反復回数です。
     */
    int iterations;

    /**
     * モデルの評価回数です。
     */
    int evaluations;

    /**
     * パラメータ (d0, z0, Θ) の共分散行列です（3×3）。
     */
    double[][] covariance;

    /**
     * ウエスト直径 d0 の標準誤差です。
     */
    double waistDiameterError;

    /**
     * ウエスト位置 z0 の標準誤差です。
     */
    double waistPositionError;

    /**
     * 全角広がり Θ の標準誤差です。
     */
    double fullDivergenceError;

    /**
     * M² の標準誤差（誤差伝播）です。
     */
    double m2Error;

    /**
     * レイリー長 zR の標準誤差（誤差伝播）です。
     */
    double rayleighRangeError;

    /**
     * |z - z0| ≤ zR のサンプル数です。
     */
    int samplesWithinRayleighRange;

    /**
     * |z - z0| ≥ 2zR のサンプル数です。
     */
    int samplesBeyondTwoRayleighRanges;

    /**
     * ウエスト半径 w0 の標準誤差を返します。
     *
     * @return w0 の標準誤差です
     */
    public double waistRadiusError() {
        return 0.5 * waistDiameterError;
    }

    /**
     * 半角広がり θ の標準誤差を返します。
     *
     * @return θ の標準誤差です
     */
    public double halfDivergenceError() {
        return 0.5 * fullDivergenceError;
    }
}
