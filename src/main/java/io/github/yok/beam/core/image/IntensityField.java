package io.github.yok.beam.core.image;

import java.util.Arrays;

/**
 * 2 次元の光強度分布（画素ごとの強度）を表す不変クラスです。
 *
 * <p>
 * インデックス変換は {@code index = y * width + x} です。画素中心は整数座標上にあり、x は列、y は行を表します。
 * 生成時に呼び出し側の配列を複製するため、呼び出し側の配列が後から変更されても影響を受けません。
 * </p>
 */
public final class IntensityField {

    /**
     * x 方向の画素数です。
     */
    private final int width;

    /**
     * y 方向の画素数です。
     */
    private final int height;

    /**
     * 行優先で並べた強度配列です。
     */
    private final double[] data;

    /**
     * 強度分布を生成します。
     *
     * @param width x 方向の画素数です（1 以上）
     * @param height y 方向の画素数です（1 以上）
     * @param data 行優先の強度配列です（長さ width*height、複製して保持します）
     * @throws IllegalArgumentException サイズ不整合、または data が null の場合に発生します
     */
    public IntensityField(int width, int height, double[] data) {
        int size = checkedSize(width, height);
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        if (data.length != size) {
            throw new IllegalArgumentException(
                    "data の長さが width*height と一致しません: " + data.length + " vs " + size);
        }
        this.width = width;
        this.height = height;
        this.data = Arrays.copyOf(data, data.length);
    }

    /**
     * 行配列（{@code rows[y][x]}）から強度分布を生成します。
     *
     * @param rows 行配列です（全行が同じ長さであること）
     * @return 強度分布です
     * @throws IllegalArgumentException rows が空、または行の長さが揃っていない場合に発生します
     */
    public static IntensityField fromRows(double[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            throw new IllegalArgumentException("rows は 1 行以上・1 列以上が必要です");
        }
        int h = rows.length;
        int w = rows[0].length;
        double[] buf = new double[checkedSize(w, h)];
        for (int y = 0; y < h; y++) {
            if (rows[y] == null || rows[y].length != w) {
                throw new IllegalArgumentException("行の長さが揃っていません: y=" + y);
            }
            System.arraycopy(rows[y], 0, buf, y * w, w);
        }
        return new IntensityField(w, h, buf);
    }

    /**
     * 全画素が 0 の強度分布を生成します。
     *
     * @param width x 方向の画素数です
     * @param height y 方向の画素数です
     * @return 強度分布です
     * @throws IllegalArgumentException サイズが不正、または配列長の上限を超える場合に発生します
     */
    public static IntensityField zeros(int width, int height) {
        return new IntensityField(width, height, new double[checkedSize(width, height)]);
    }

    /**
     * 画素数 {@code width * height} を桁あふれなしで求めます。
     *
     * @param width x 方向の画素数です
     * @param height y 方向の画素数です
     * @return 画素数です
     * @throws IllegalArgumentException サイズが 1 未満、または int の範囲を超える場合に発生します
     */
    static int checkedSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width/height は 1 以上が必要です: " + width + "x" + height);
        }
        long size = (long) width * height;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "画素数が配列長の上限を超えています: " + width + "x" + height + " = " + size);
        }
        return (int) size;
    }

    /**
     * x 方向の画素数を返します。
     *
     * @return x 方向の画素数です
     */
    public int width() {
        return width;
    }

    /**
     * y 方向の画素数を返します。
     *
     * @return y 方向の画素数です
     */
    public int height() {
        return height;
    }

    /**
     * 画素数を返します。
     *
     * @return 画素数です
     */
    public int pixelCount() {
        return data.length;
    }

    /**
     * 座標 (x, y) をインデックスに変換します。
     *
     * @param x x 座標です（0 以上 width 未満）
     * @param y y 座標です（0 以上 height 未満）
     * @return インデックスです
     */
    public int indexOf(int x, int y) {
        return y * width + x;
    }

    /**
     * 画素 (x, y) の強度を返します。
     *
     * @param x x 座標です（0 以上 width 未満）
     * @param y y 座標です（0 以上 height 未満）
     * @return 強度です
     */
    public double get(int x, int y) {
        return data[indexOf(x, y)];
    }

    /**
     * 全体を覆う矩形領域を返します。
     *
     * @return 全体領域です
     */
    public PixelRegion fullRegion() {
        return new PixelRegion(0, 0, width, height);
    }

    /**
     * 指定領域を画像内に切り詰めて返します。
     *
     * @param region 領域です（null の場合は全体領域）
     * @return 画像内に切り詰めた領域です
     */
    public PixelRegion clip(PixelRegion region) {
        return (region == null) ? fullRegion() : fullRegion().intersect(region);
    }

    /**
     * 強度の総和を返します。
     *
     * @return 総和です
     */
    public double total() {
        double s = 0.0;
        for (double v : data) {
            s += v;
        }
        return s;
    }

    /**
     * 強度配列の複製（行優先）を返します。
     *
     * @return 強度配列の複製です
     */
    public double[] toArray() {
        return Arrays.copyOf(data, data.length);
    }
}
