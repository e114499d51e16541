package io.github.yok.beam.core.error;

/**
 * 強度の総和が 0（または有限値でない）ため、重心・分散が計算できない場合に発生します。
 */
public class DegenerateInputException extends BeamAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DegenerateInputException(String message) {
        super(message);
    }
}
