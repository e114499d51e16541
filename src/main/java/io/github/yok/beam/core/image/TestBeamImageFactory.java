package io.github.yok.beam.core.image;

/**
 * 楕円ガウスビームの合成画像を生成するクラスです。
 *
 * <p>
 * 強度は {@code peak * exp(-2 (u/r_major)^2 - 2 (v/r_minor)^2) + floor} です。ここで u, v は φ だけ回転した
 * 主軸座標、r は 1/e² 半径（直径の半分）です。このとき二次モーメント直径（D4σ）は指定した直径と一致します。
 * </p>
 */
public final class TestBeamImageFactory {

    private TestBeamImageFactory() {}

    /**
     * 背景のない楕円ガウス画像を生成します。
     *
     * @param width x 方向の画素数です
     * @param height y 方向の画素数です
     * @param xc 中心 x（画素）です
     * @param yc 中心 y（画素）です
     * @param dMajor 長軸方向の直径（画素）です（正）
     * @param dMinor 短軸方向の直径（画素）です（正）
     * @param phi 長軸の向き（rad、+x から +y 方向）です
     * @param peak ピーク強度です
     * @return 強度分布です
     */
    public static IntensityField create(int width, int height, double xc, double yc,
            double dMajor, double dMinor, double phi, double peak) {
        return create(width, height, xc, yc, dMajor, dMinor, phi, peak, 0.0);
    }

    /**
     * 一様な背景（ノイズ床）を加えた楕円ガウス画像を生成します。
     *
     * @param width x 方向の画素数です
     * @param height y 方向の画素数です
     * @param xc 中心 x（画素）です
     * @param yc 中心 y（画素）です
     * @param dMajor 長軸方向の直径（画素）です（正）
     * @param dMinor 短軸方向の直径（画素）です（正）
     * @param phi 長軸の向き（rad、+x から +y 方向）です
     * @param peak ピーク強度です
     * @param floor 全画素に加える一様背景です（0 以上）
     * @return 強度分布です
     * @throws IllegalArgumentException 直径が正でない、または floor が負の場合に発生します
     */
    public static IntensityField create(int width, int height, double xc, double yc,
            double dMajor, double dMinor, double phi, double peak, double floor) {
        if (!(dMajor > 0.0) || !(dMinor > 0.0)) {
            throw new IllegalArgumentException(
                    "直径は正である必要があります: dMajor=" + dMajor + ", dMinor=" + dMinor);
        }
        if (!(floor >= 0.0)) {
            throw new IllegalArgumentException("floor は 0 以上が必要です: " + floor);
        }
        double rMajor = dMajor / 2.0;
        double rMinor = dMinor / 2.0;
        double cos = Math.cos(phi);
        double sin = Math.sin(phi);

        double[] buf = new double[IntensityField.checkedSize(width, height)];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double dx = x - xc;
                double dy = y - yc;
                double u = (dx * cos + dy * sin) / rMajor;
                double v = (-dx * sin + dy * cos) / rMinor;
                buf[y * width + x] = peak * Math.exp(-2.0 * (u * u + v * v)) + floor;
            }
        }
        return new IntensityField(width, height, buf);
    }
}
