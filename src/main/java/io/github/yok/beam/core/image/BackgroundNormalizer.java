package io.github.yok.beam.core.image;

import lombok.Value;

/**
 * 背景を差し引き、負の強度を 0 に切り詰めた非負の強度分布を生成するクラスです。
 *
 * <p>
 * 背景はスカラー値、同サイズの背景画像、または画像四隅の統計量（ISO 11146-3 の四隅法）から与えます。 入力の強度分布は変更しません。
 * </p>
 */
public final class BackgroundNormalizer {

    /**
     * 四隅法で使用する既定の四隅の割合です。
     */
    public static final double DEFAULT_CORNER_FRACTION = 0.035;

    /**
     * 四隅法で使用する既定の標準偏差倍率です。
     */
    public static final double DEFAULT_NOISE_MULTIPLIER = 3.0;

    /**
     * スカラー背景を差し引きます。
     *
     * @param field 強度分布です（null 不可）
     * @param background 背景値です（有限値）
     * @return 背景を差し引いて 0 未満を 0 にした強度分布です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public IntensityField subtract(IntensityField field, double background) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        if (!Double.isFinite(background)) {
            throw new IllegalArgumentException("background は有限値を指定してください: " + background);
        }
        double[] buf = field.toArray();
        for (int i = 0; i < buf.length; i++) {
            buf[i] = clip(buf[i] - background);
        }
        return new IntensityField(field.width(), field.height(), buf);
    }

    /**
     * 背景画像を画素ごとに差し引きます。
     *
     * @param field 強度分布です（null 不可）
     * @param background 背景画像です（null 不可、同サイズ）
     * @return 背景を差し引いて 0 未満を 0 にした強度分布です
     * @throws IllegalArgumentException 引数が不正、またはサイズが一致しない場合に発生します
     */
    public IntensityField subtract(IntensityField field, IntensityField background) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        if (background == null) {
            throw new IllegalArgumentException("background は null 不可です");
        }
        if (field.width() != background.width() || field.height() != background.height()) {
            throw new IllegalArgumentException("背景画像のサイズが一致しません: " + field.width() + "x"
                    + field.height() + " vs " + background.width() + "x" + background.height());
        }
        double[] buf = field.toArray();
        double[] bg = background.toArray();
        for (int i = 0; i < buf.length; i++) {
            buf[i] = clip(buf[i] - bg[i]);
        }
        return new IntensityField(field.width(), field.height(), buf);
    }

    /**
     * 負の強度（および NaN）を 0 に切り詰めます。
     *
     * @param field 強度分布です（null 不可）
     * @return 非負の強度分布です
     */
    public IntensityField clipNegatives(IntensityField field) {
        return subtract(field, 0.0);
    }

    /**
     * 画像四隅の平均と標準偏差を計算します。
     *
     * <p>
     * 四隅の矩形は幅 {@code floor(fraction * width)}、高さ {@code floor(fraction * height)}（最小 1 画素）です。
     * </p>
     *
     * @param field 強度分布です（null 不可）
     * @param cornerFraction 四隅の割合です（0 より大きく 0.5 以下）
     * @return 四隅の統計量です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CornerStatistics cornerBackground(IntensityField field, double cornerFraction) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        if (!(cornerFraction > 0.0 && cornerFraction <= 0.5)) {
            throw new IllegalArgumentException("cornerFraction は (0, 0.5] が必要です: " + cornerFraction);
        }
        int w = field.width();
        int h = field.height();
        int cw = Math.max(1, (int) Math.floor(cornerFraction * w));
        int ch = Math.max(1, (int) Math.floor(cornerFraction * h));

        PixelRegion[] corners = {new PixelRegion(0, 0, cw, ch), new PixelRegion(w - cw, 0, w, ch),
                new PixelRegion(0, h - ch, cw, h), new PixelRegion(w - cw, h - ch, w, h)};

        // 平均（1 パス目）
        double sum = 0.0;
        long count = 0;
        for (PixelRegion c : corners) {
            for (int y = c.getY0(); y < c.getY1(); y++) {
                for (int x = c.getX0(); x < c.getX1(); x++) {
                    sum += field.get(x, y);
                    count++;
                }
            }
        }
        double mean = sum / count;

        // 分散（2 パス目、母分散）
        double sq = 0.0;
        for (PixelRegion c : corners) {
            for (int y = c.getY0(); y < c.getY1(); y++) {
                for (int x = c.getX0(); x < c.getX1(); x++) {
                    double d = field.get(x, y) - mean;
                    sq += d * d;
                }
            }
        }
        return new CornerStatistics(mean, Math.sqrt(sq / count), count);
    }

    /**
     * 四隅法で推定した背景 {@code mean + noiseMultiplier * stdev} を差し引きます。
     *
     * @param field 強度分布です（null 不可）
     * @param cornerFraction 四隅の割合です
     * @param noiseMultiplier 標準偏差の倍率です（0 以上）
     * @return 背景を差し引いた非負の強度分布です
     */
    public IntensityField subtractCornerBackground(IntensityField field, double cornerFraction,
            double noiseMultiplier) {
        if (!(noiseMultiplier >= 0.0)) {
            throw new IllegalArgumentException("noiseMultiplier は 0 以上が必要です: " + noiseMultiplier);
        }
        CornerStatistics stats = cornerBackground(field, cornerFraction);
        return subtract(field, stats.getMean() + noiseMultiplier * stats.getStdev());
    }

    /**
     * 既定値（四隅 3.5%、3σ）で四隅背景を差し引きます。
     *
     * @param field 強度分布です（null 不可）
     * @return 背景を差し引いた非負の強度分布です
     */
    public IntensityField subtractCornerBackground(IntensityField field) {
        return subtractCornerBackground(field, DEFAULT_CORNER_FRACTION, DEFAULT_NOISE_MULTIPLIER);
    }

    private static double clip(double v) {
        // NaN も 0 に寄せる
        return (v > 0.0) ? v : 0.0;
    }

    /**
     * 画像四隅の統計量です。
     */
    @Value
    public static class CornerStatistics {

        /**
         * 四隅画素の平均です。
         */
        double mean;

        /**
         * 四隅画素の標準偏差（母標準偏差）です。
         */
        double stdev;

        /**
         * 集計した画素数です。
         */
        long pixelCount;
    }
}
