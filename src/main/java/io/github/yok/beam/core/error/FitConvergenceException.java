package io.github.yok.beam.core.error;

/**
 * M² フィットの最適化が反復上限内に収束しなかった場合に発生します。
 *
 * <p>
 * フィットパラメータは互いに依存するため、部分的な結果は返しません。
 * </p>
 */
public class FitConvergenceException extends BeamAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public FitConvergenceException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public FitConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
