package io.github.yok.beam.core.error;

/**
 * ビーム計測・M² フィットで発生する例外の基底クラスです。
 *
 * <p>
 * 入力が構造的に不足している、または矛盾している場合に発生させます。 数値的な軽微な不整合は例外ではなく警告として結果に含めます。
 * </p>
 */
public class BeamAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public BeamAnalysisException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public BeamAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
