package io.github.yok.beam.core.error;

/**
 * M² フィットに必要な異なる z 位置のサンプル数（3 点）が不足している場合に発生します。
 */
public class InsufficientDataException extends BeamAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public InsufficientDataException(String message) {
        super(message);
    }
}
