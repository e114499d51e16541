package io.github.yok.beam.core.beam;

/**
 * 計測結果は返すが、呼び出し側で確認すべき状態を表します。
 */
public enum MeasurementWarning {

    /**
     * マスク反復が上限回数までに収束しませんでした（最後の推定値を返しています）。
     */
    CONVERGENCE,

    /**
     * 共分散行列が半正定値でなく、負の固有値を 0 に切り詰めました。
     */
    NUMERIC_INSTABILITY,

    /**
     * 楕円マスク内の強度が不足したため、直前の有効な推定値を返しています。
     */
    MASK_COLLAPSE
}
