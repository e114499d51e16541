package io.github.yok.beam.core.beam;

import lombok.Value;

/**
 * 1 枚の画像から求めたビームパラメータ（重心・D4σ 直径・向き）を保持するクラスです。
 *
 * <p>
 * {@code dMajor >= dMinor >= 0} で、φ は長軸の向き（+x から +y 方向、rad、{@code [-π/2, π/2)}）です。
 * 楕円率は保持せず、常に直径から計算します。
 * </p>
 */
@Value
public class BeamParameters {

    /**
     * 重心 x です。
     */
    double xc;

    /**
     * 重心 y です。
     */
    double yc;

    /**
     * 長軸方向の直径（D4σ）です。
     */
    double dMajor;

    /**
     * 短軸方向の直径（D4σ）です。
     */
    double dMinor;

    /**
     * 長軸の向き（rad）です。
     */
    double phi;

    /**
     * 楕円率 {@code min(d) / max(d)} を返します。両直径が 0 の場合は 1 を返します。
     *
     * @return 楕円率です（0 以上 1 以下）
     */
    public double ellipticity() {
        double max = Math.max(dMajor, dMinor);
        if (max == 0.0) {
            return 1.0;
        }
        return Math.min(dMajor, dMinor) / max;
    }

    /**
     * 長軸と短軸の直径の二乗平均平方根（等価円直径）を返します。
     *
     * @return 等価円直径です
     */
    public double equivalentDiameter() {
        return Math.sqrt(0.5 * (dMajor * dMajor + dMinor * dMinor));
    }

    /**
     * 画素単位の値を物理単位に換算したパラメータを返します。角度は変わりません。
     *
     * @param pixelSize 1 画素あたりの物理長です（正）
     * @return 換算したパラメータです
     * @throws IllegalArgumentException pixelSize が正でない場合に発生します
     */
    public BeamParameters scaled(double pixelSize) {
        if (!(pixelSize > 0.0) || !Double.isFinite(pixelSize)) {
            throw new IllegalArgumentException("pixelSize は正の有限値が必要です: " + pixelSize);
        }
        return new BeamParameters(xc * pixelSize, yc * pixelSize, dMajor * pixelSize,
                dMinor * pixelSize, phi);
    }
}
