package io.github.yok.beam.core.propagation;

import java.util.Set;
import lombok.Value;

/**
 * M² フィットの結果です。
 *
 * <p>
 * 長さの単位は入力（z, d, λ）と同じです。{@code M² = π w0 θ / λ}、{@code zR = π w0² / (M² λ) = d0 / Θ} が成り立ちます。
 * </p>
 */
@Value
public class M2FitResult {

    /**
     * ウエスト直径 d0 です。
     */
    double waistDiameter;

    /**
     * ウエスト半径 w0 です。
     */
    double waistRadius;

    /**
     * ウエスト位置 z0 です。
     */
    double waistPosition;

    /**
     * 全角広がり Θ（rad）です。
     */
    double fullDivergence;

    /**
     * 半角広がり θ（rad）です。
     */
    double halfDivergence;

    /**
     * レイリー長 zR です。
     */
    double rayleighRange;

    /**
     * ビーム品質 M² です。
     */
    double m2;

    /**
     * 波長 λ です。
     */
    double wavelength;

    /**
     * 診断情報です。
     */
    FitDiagnostics diagnostics;

    /**
     * 警告の集合です（変更不可）。
     */
    Set<FitWarning> warnings;

    /**
     * 物理的に妥当な結果（{@link FitWarning#PHYSICALLY_INVALID} なし）かどうかを返します。
     *
     * @return 妥当なら true です
     */
    public boolean isPhysicallyValid() {
        return !warnings.contains(FitWarning.PHYSICALLY_INVALID);
    }

    /**
     * ビームパラメータ積 {@code w0 θ} を返します。
     *
     * @return ビームパラメータ積です
     */
    public double beamParameterProduct() {
        return waistRadius * halfDivergence;
    }

    /**
     * フィットしたモデルで位置 z の直径を返します。
     *
     * @param z 光軸上の位置です
     * @return 直径です
     */
    public double diameterAt(double z) {
        double dz = z - waistPosition;
        return Math.sqrt(waistDiameter * waistDiameter + fullDivergence * fullDivergence * dz * dz);
    }
}
