package io.github.yok.beam.core.moment;

import io.github.yok.beam.core.image.PixelRegion;

/**
 * モーメント計算の対象画素を絞り込むマスクを表すインタフェースです。
 */
public interface PixelMask {

    /**
     * 画素 (x, y) がマスク内かどうかを返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @return マスク内なら true です
     */
    boolean contains(int x, int y);

    /**
     * マスクを囲む矩形領域を返します（画像外にはみ出してもかまいません）。
     *
     * @return 外接矩形です
     */
    PixelRegion bounds();
}
