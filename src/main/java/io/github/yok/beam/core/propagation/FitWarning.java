package io.github.yok.beam.core.propagation;

/**
 * フィット結果は返すが、呼び出し側で採否を判断すべき状態を表します。
 */
public enum FitWarning {

    /**
     * M² &lt; 1 またはウエスト径 0 など、物理的にあり得ない結果です。
     */
    PHYSICALLY_INVALID,

    /**
     * ISO 11146 のサンプリング推奨（10 点以上、うち 5 点以上が zR 以内、5 点以上が 2zR より外）を満たしていません。
     */
    ISO_SAMPLING
}
