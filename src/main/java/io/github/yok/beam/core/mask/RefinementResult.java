package io.github.yok.beam.core.mask;

import io.github.yok.beam.core.beam.BeamParameters;
import io.github.yok.beam.core.error.MaskCollapseException;
import io.github.yok.beam.core.moment.MomentSet;
import java.util.List;
import lombok.Value;

/**
 * マスク反復の最終結果です。
 *
 * <p>
 * 終了理由が収束・上限到達・マスク崩壊のいずれであっても、最後に有効だったモーメントを保持します。
 * </p>
 */
@Value
public class RefinementResult {

    /**
     * 最後に有効だったモーメントです。
     */
    MomentSet moments;

    /**
     * 最後に有効だったビームパラメータです。
     */
    BeamParameters parameters;

    /**
     * 完了したマスク反復の回数です。
     */
    int iterations;

    /**
     * 終了理由です。
     */
    TerminationReason terminationReason;

    /**
     * 最終反復での相対変化量です。
     */
    double lastRelativeChange;

    /**
     * 負の固有値を 0 に切り詰めたかどうかです。
     */
    boolean clamped;

    /**
     * マスク崩壊の詳細です（崩壊しなかった場合は null）。
     */
    MaskCollapseException maskCollapse;

    /**
     * 反復 0（初期状態）からのビームパラメータの履歴です。
     */
    List<BeamParameters> history;

    /**
     * 収束したかどうかを返します。
     *
     * @return 収束した場合は true です
     */
    public boolean isConverged() {
        return terminationReason == TerminationReason.CONVERGED;
    }
}
