package io.github.yok.beam.core.moment;

import lombok.Value;

/**
 * 強度重み付きの 0 次・1 次・2 次中心モーメントを保持するクラスです。
 *
 * <p>
 * 反復ごとに常に最初から計算し直します（差分更新はしません）。
 * </p>
 */
@Value
public class MomentSet {

    /**
     * 強度の総和です。
     */
    double totalIntensity;

    /**
     * 重心 x（画素）です。
     */
    double xc;

    /**
     * 重心 y（画素）です。
     */
    double yc;

    /**
     * x 方向の分散 σx² です。
     */
    double varX;

    /**
     * y 方向の分散 σy² です。
     */
    double varY;

    /**
     * 共分散 σxy です。
     */
    double covXY;

    /**
     * 集計に使った画素数です。
     */
    long pixelCount;
}
