package io.github.yok.beam.core.mask;

/**
 * マスク反復の終了理由です。
 */
public enum TerminationReason {

    /**
     * 相対変化量が許容値を下回りました。
     */
    CONVERGED,

    /**
     * 最大反復回数に到達しました。
     */
    ITERATION_LIMIT,

    /**
     * マスク内の強度が不足し、直前の推定値で打ち切りました。
     */
    MASK_COLLAPSED,

    /**
     * マスク反復を行っていません（矩形領域全体のモーメントのみ）。
     */
    NOT_REFINED
}
