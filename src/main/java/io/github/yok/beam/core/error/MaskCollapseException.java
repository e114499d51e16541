package io.github.yok.beam.core.error;

import lombok.Getter;

/**
 * 楕円マスク内の強度がほぼ 0 になり、モーメントを再計算できなくなったことを表します。
 *
 * <p>
 * マスク反復ではこの例外を送出せず、直前の有効なモーメントを採用したうえで結果に保持します。
 * </p>
 */
@Getter
public class MaskCollapseException extends BeamAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * マスクが崩壊した反復番号です（1 始まり）。
     */
    private final int iteration;

    /**
     * 例外を生成します。
     *
     * @param iteration マスクが崩壊した反復番号です
     * @param maskedIntensity マスク内の強度総和です
     * @param cause 原因です（null 可）
     */
    public MaskCollapseException(int iteration, double maskedIntensity, Throwable cause) {
        super("楕円マスク内の強度が不足しています。反復=" + iteration + "、強度総和=" + maskedIntensity, cause);
        this.iteration = iteration;
    }
}
