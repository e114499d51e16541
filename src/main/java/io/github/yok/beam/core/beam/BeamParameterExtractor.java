package io.github.yok.beam.core.beam;

import io.github.yok.beam.core.moment.MomentSet;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * モーメントから D4σ 直径・向き・楕円率を求めるクラスです。
 *
 * <p>
 * 2×2 共分散行列 {@code [[σx², σxy], [σxy, σy²]]} の固有値を閉形式で求め、直径を {@code 4 * sqrt(固有値)} とします。
 * 向きは {@code φ = atan2(2σxy, σx² - σy²) / 2} です。
 * </p>
 */
@Slf4j
public final class BeamParameterExtractor {

    /**
     * モーメントからビームパラメータを求めます。
     *
     * @param moments モーメントです（null 不可）
     * @return 抽出結果です
     * @throws IllegalArgumentException moments が null の場合に発生します
     */
    public Extraction extract(MomentSet moments) {
        if (moments == null) {
            throw new IllegalArgumentException("moments は null 不可です");
        }
        double a = moments.getVarX();
        double c = moments.getVarY();
        double b = moments.getCovXY();

        double mean = 0.5 * (a + c);
        double half = 0.5 * (a - c);
        double disc = Math.sqrt(half * half + b * b);

        double lambdaMajor = mean + disc;
        double lambdaMinor = mean - disc;

        boolean clamped = false;
        if (lambdaMinor < 0.0) {
            // 浮動小数点の打ち消しで半正定値性が崩れた場合
            log.warn("共分散行列が半正定値ではありません。負の固有値を 0 に切り詰めます。λ=({}, {})、σ=({}, {}, {})",
                    lambdaMajor, lambdaMinor, a, c, b);
            lambdaMinor = 0.0;
            lambdaMajor = Math.max(lambdaMajor, 0.0);
            clamped = true;
        }

        double phi = normalizeAngle(0.5 * Math.atan2(2.0 * b, a - c));

        BeamParameters p = new BeamParameters(moments.getXc(), moments.getYc(),
                4.0 * Math.sqrt(lambdaMajor), 4.0 * Math.sqrt(lambdaMinor), phi);
        return new Extraction(p, clamped);
    }

    /**
     * 向きを固定してビームパラメータを求めます。
     *
     * <p>
     * 固定した向きとその直交方向の分散から直径を求め、大きい方を長軸直径、小さい方を短軸直径とします。 向きには固定値（{@code [-π/2, π/2)} に正規化）を返します。
     * </p>
     *
     * @param moments モーメントです（null 不可）
     * @param fixedPhi 固定する向き（rad）です（有限値）
     * @return 抽出結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public Extraction extract(MomentSet moments, double fixedPhi) {
        if (moments == null) {
            throw new IllegalArgumentException("moments は null 不可です");
        }
        if (!Double.isFinite(fixedPhi)) {
            throw new IllegalArgumentException("fixedPhi は有限値を指定してください: " + fixedPhi);
        }
        AxisDiameters axes = diametersAlong(moments, fixedPhi);
        BeamParameters p = new BeamParameters(moments.getXc(), moments.getYc(),
                Math.max(axes.getAlong(), axes.getAcross()),
                Math.min(axes.getAlong(), axes.getAcross()), normalizeAngle(fixedPhi));
        return new Extraction(p, axes.isClamped());
    }

    /**
     * 指定した向きとその直交方向の D4σ 直径を求めます。
     *
     * @param moments モーメントです（null 不可）
     * @param phi 向き（rad）です
     * @return 向きに沿った直径と直交方向の直径です
     */
    public AxisDiameters diametersAlong(MomentSet moments, double phi) {
        double a = moments.getVarX();
        double c = moments.getVarY();
        double b = moments.getCovXY();
        double cos = Math.cos(phi);
        double sin = Math.sin(phi);

        double varAlong = a * cos * cos + 2.0 * b * sin * cos + c * sin * sin;
        double varAcross = a * sin * sin - 2.0 * b * sin * cos + c * cos * cos;

        boolean clamped = false;
        if (varAlong < 0.0) {
            varAlong = 0.0;
            clamped = true;
        }
        if (varAcross < 0.0) {
            varAcross = 0.0;
            clamped = true;
        }
        if (clamped) {
            log.warn("軸方向の分散が負になりました。0 に切り詰めます。φ={}、σ=({}, {}, {})", phi, a, c, b);
        }
        return new AxisDiameters(4.0 * Math.sqrt(varAlong), 4.0 * Math.sqrt(varAcross), clamped);
    }

    /**
     * 角度を {@code [-π/2, π/2)} に正規化します（楕円の軸は π 周期）。
     *
     * @param phi 角度（rad）です
     * @return 正規化した角度です
     */
    static double normalizeAngle(double phi) {
        double r = phi - Math.PI * Math.floor((phi + 0.5 * Math.PI) / Math.PI);
        // 丸めで π/2 に到達した場合
        return (r >= 0.5 * Math.PI) ? r - Math.PI : r;
    }

    /**
     * 抽出結果です。
     */
    @Value
    public static class Extraction {

        /**
         * ビームパラメータです。
         */
        BeamParameters parameters;

        /**
         * 負の固有値（分散）を 0 に切り詰めたかどうかです。
         */
        boolean clamped;
    }

    /**
     * 指定方向とその直交方向の直径です。
     */
    @Value
    public static class AxisDiameters {

        /**
         * 指定方向の直径です。
         */
        double along;

        /**
         * 直交方向の直径です。
         */
        double across;

        /**
         * 負の分散を 0 に切り詰めたかどうかです。
         */
        boolean clamped;
    }
}
