package io.github.yok.beam.core.mask;

import io.github.yok.beam.core.image.PixelRegion;
import io.github.yok.beam.core.moment.PixelMask;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 中心・半軸・回転角で定まる楕円形の関心領域です。
 *
 * <p>
 * 半軸が半画素未満の場合は半画素に引き上げます（点状のビームでも自身の画素を含めるため）。
 * </p>
 */
@Getter
public final class EllipticalMask implements PixelMask {

    /**
     * 半軸の下限（画素）です。
     */
    static final double MIN_SEMI_AXIS = 0.5;

    /**
     * 中心 x です。
     */
    private final double xc;

    /**
     * 中心 y です。
     */
    private final double yc;

    /**
     * 向き φ 方向の半軸です。
     */
    private final double semiAxisAlong;

    /**
     * 直交方向の半軸です。
     */
    private final double semiAxisAcross;

    /**
     * 回転角（rad）です。
     */
    private final double phi;

    @Getter(AccessLevel.NONE)
    private final double cos;

    @Getter(AccessLevel.NONE)
    private final double sin;

    /**
     * 楕円マスクを生成します。
     *
     * @param xc 中心 x です
     * @param yc 中心 y です
     * @param semiAxisAlong 向き φ 方向の半軸です（0 以上）
     * @param semiAxisAcross 直交方向の半軸です（0 以上）
     * @param phi 回転角（rad）です
     * @throws IllegalArgumentException 値が有限でない、または半軸が負の場合に発生します
     */
    public EllipticalMask(double xc, double yc, double semiAxisAlong, double semiAxisAcross,
            double phi) {
        if (!Double.isFinite(xc) || !Double.isFinite(yc) || !Double.isFinite(phi)) {
            throw new IllegalArgumentException(
                    "中心・回転角は有限値が必要です: (" + xc + ", " + yc + "), φ=" + phi);
        }
        if (!(semiAxisAlong >= 0.0) || !(semiAxisAcross >= 0.0) || Double.isInfinite(semiAxisAlong)
                || Double.isInfinite(semiAxisAcross)) {
            throw new IllegalArgumentException(
                    "半軸は 0 以上の有限値が必要です: " + semiAxisAlong + ", " + semiAxisAcross);
        }
        this.xc = xc;
        this.yc = yc;
        this.semiAxisAlong = Math.max(semiAxisAlong, MIN_SEMI_AXIS);
        this.semiAxisAcross = Math.max(semiAxisAcross, MIN_SEMI_AXIS);
        this.phi = phi;
        this.cos = Math.cos(phi);
        this.sin = Math.sin(phi);
    }

    /**
     * 画素 (x, y) が楕円の内側（境界を含む）かどうかを返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @return 内側なら true です
     */
    @Override
    public boolean contains(int x, int y) {
        double dx = x - xc;
        double dy = y - yc;
        double u = (dx * cos + dy * sin) / semiAxisAlong;
        double v = (-dx * sin + dy * cos) / semiAxisAcross;
        return u * u + v * v <= 1.0;
    }

    /**
     * 楕円の外接矩形を返します。
     *
     * @return 外接矩形です
     */
    @Override
    public PixelRegion bounds() {
        double a = semiAxisAlong;
        double b = semiAxisAcross;
        double ex = Math.sqrt(a * a * cos * cos + b * b * sin * sin);
        double ey = Math.sqrt(a * a * sin * sin + b * b * cos * cos);
        return new PixelRegion(toIndex(Math.floor(xc - ex)), toIndex(Math.floor(yc - ey)),
                toIndex(Math.ceil(xc + ex) + 1), toIndex(Math.ceil(yc + ey) + 1));
    }

    private static int toIndex(double v) {
        // 画像サイズを大きく超える値は int の範囲に丸める（後段で画像内に切り詰める）
        if (v >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (v <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) v;
    }
}
