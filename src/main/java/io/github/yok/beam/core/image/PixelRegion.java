package io.github.yok.beam.core.image;

import lombok.Value;

/**
 * 画素の矩形領域 {@code [x0, x1) × [y0, y1)} を表すクラスです。
 *
 * <p>
 * 右端・下端は含みません。空の領域（幅または高さが 0）も表現できます。
 * </p>
 */
@Value
public class PixelRegion {

    /**
     * 左端 x（含む）です。
     */
    int x0;

    /**
     * 上端 y（含む）です。
     */
    int y0;

    /**
     * 右端 x（含まない）です。
     */
    int x1;

    /**
     * 下端 y（含まない）です。
     */
    int y1;

    /**
     * 矩形領域を生成します。
     *
     * @param x0 左端 x（含む）です
     * @param y0 上端 y（含む）です
     * @param x1 右端 x（含まない）です
     * @param y1 下端 y（含まない）です
     * @throws IllegalArgumentException x1 &lt; x0 または y1 &lt; y0 の場合に発生します
     */
    public PixelRegion(int x0, int y0, int x1, int y1) {
        if (x1 < x0 || y1 < y0) {
            throw new IllegalArgumentException(
                    "領域の範囲が不正です: [" + x0 + ", " + x1 + ") x [" + y0 + ", " + y1 + ")");
        }
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    /**
     * 幅を返します。
     *
     * @return 幅です
     */
    public int width() {
        return x1 - x0;
    }

    /**
     * 高さを返します。
     *
     * @return 高さです
     */
    public int height() {
        return y1 - y0;
    }

    /**
     * 画素を 1 つも含まないかどうかを返します。
     *
     * @return 空なら true です
     */
    public boolean isEmpty() {
        return width() == 0 || height() == 0;
    }

    /**
     * 他の領域との共通部分を返します。共通部分がない場合は空の領域を返します。
     *
     * @param other 他の領域です（null 不可）
     * @return 共通部分です
     */
    public PixelRegion intersect(PixelRegion other) {
        if (other == null) {
            throw new IllegalArgumentException("other は null 不可です");
        }
        int nx0 = Math.max(x0, other.x0);
        int ny0 = Math.max(y0, other.y0);
        int nx1 = Math.min(x1, other.x1);
        int ny1 = Math.min(y1, other.y1);
        if (nx1 <= nx0 || ny1 <= ny0) {
            return new PixelRegion(nx0, ny0, nx0, ny0);
        }
        return new PixelRegion(nx0, ny0, nx1, ny1);
    }
}
