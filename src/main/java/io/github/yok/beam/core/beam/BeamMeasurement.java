package io.github.yok.beam.core.beam;

import io.github.yok.beam.core.error.MaskCollapseException;
import io.github.yok.beam.core.mask.TerminationReason;
import java.util.List;
import java.util.Set;
import lombok.Value;

/**
 * 1 枚の画像の計測結果（ビームパラメータと診断情報）です。
 */
@Value
public class BeamMeasurement {

    /**
     * ビームパラメータ（画素単位）です。
     */
    BeamParameters parameters;

    /**
     * 完了したマスク反復の回数です。
     */
    int iterations;

    /**
     * マスク反復の終了理由です。
     */
    TerminationReason terminationReason;

    /**
     * 警告の集合です（変更不可）。
     */
    Set<MeasurementWarning> warnings;

    /**
     * マスク崩壊の詳細です（崩壊しなかった場合は null）。
     */
    MaskCollapseException maskCollapse;

    /**
     * 反復 0（初期状態）からのビームパラメータの履歴です。
     */
    List<BeamParameters> history;

    /**
     * マスク反復が収束したかどうかを返します。
     *
     * @return 収束した場合は true です
     */
    public boolean isConverged() {
        return terminationReason == TerminationReason.CONVERGED;
    }

    /**
     * 指定した警告を含むかどうかを返します。
     *
     * @param warning 警告です
     * @return 含む場合は true です
     */
    public boolean hasWarning(MeasurementWarning warning) {
        return warnings.contains(warning);
    }

    /**
     * 物理単位に換算したビームパラメータを返します。
     *
     * @param pixelSize 1 画素あたりの物理長です（正）
     * @return 換算したビームパラメータです
     */
    public BeamParameters inPhysicalUnits(double pixelSize) {
        return parameters.scaled(pixelSize);
    }
}
