package io.github.yok.beam.app;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * ビーム計測の設定値（beam.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、マスク反復と M² フィットの既定値として使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "beam")
public class BeamProperties {

    /**
     * 楕円マスク反復（ISO 11146）の設定です。
     */
    @Valid
    private Mask mask = new Mask();

    /**
     * M² フィットの設定です。
     */
    @Valid
    private Fit fit = new Fit();

    /**
     * 計測結果の単位換算の設定です。
     */
    @Valid
    private Measurement measurement = new Measurement();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "beam")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Mask m = getMask();
        Fit f = getFit();
        Measurement ms = getMeasurement();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "mask",
                // maskDiameterMultiplier: 楕円マスクの直径倍率
                "maskDiameterMultiplier", m.getMaskDiameterMultiplier(),
                // relativeTolerance: 収束判定の相対変化量
                "relativeTolerance", m.getRelativeTolerance(),
                // maxIterations: マスク反復の最大回数
                "maxIterations", m.getMaxIterations(),
                // collapseFraction: マスク崩壊とみなす強度比
                "collapseFraction", m.getCollapseFraction());

        appendSection(sb, nl, "fit",
                // maxIterations: Levenberg-Marquardt の最大反復回数
                "maxIterations", f.getMaxIterations(),
                // maxEvaluations: モデル評価回数の上限
                "maxEvaluations", f.getMaxEvaluations(),
                // costRelativeTolerance: コストの相対許容誤差
                "costRelativeTolerance", f.getCostRelativeTolerance(),
                // parameterRelativeTolerance: パラメータの相対許容誤差
                "parameterRelativeTolerance", f.getParameterRelativeTolerance());

        appendSection(sb, nl, "measurement",
                // pixelSize: 1 画素あたりの物理長
                "pixelSize", ms.getPixelSize());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Mask {

        /**
         * 楕円マスクの直径倍率です。
         *
         * <p>
         * マスクの半軸は {@code 倍率 × 現在の直径 / 2} です（ISO 11146 の慣例値は 3）。
         * </p>
         */
        @Positive
        private double maskDiameterMultiplier = 3.0;

        /**
         * 収束判定の相対変化量です。
         *
         * <p>
         * 直径は直前の直径に対する相対変化、重心は直前の長軸直径に対する相対変化で判定します。
         * </p>
         */
        @Positive
        private double relativeTolerance = 1e-3;

        /**
         * マスク反復の最大回数です。
         */
        @Min(1)
        private int maxIterations = 25;

        /**
         * マスク内強度が初期強度のこの割合以下になったときにマスク崩壊とみなします。
         */
        @DecimalMin("0.0")
        private double collapseFraction = 1e-9;
    }

    @Data
    public static class Fit {

        /**
         * Levenberg-Marquardt の最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 1000;

        /**
         * モデル評価回数の上限です。
         */
        @Min(1)
        private int maxEvaluations = 10000;

        /**
         * コスト（残差二乗和）の相対許容誤差です。
         */
        @Positive
        private double costRelativeTolerance = 1e-10;

        /**
         * パラメータの相対許容誤差です。
         */
        @Positive
        private double parameterRelativeTolerance = 1e-10;
    }

    @Data
    public static class Measurement {

        /**
         * 1 画素あたりの物理長です（直径・重心の換算に使います）。
         */
        @Positive
        private double pixelSize = 1.0;
    }
}
