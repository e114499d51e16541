package io.github.yok.beam.core.beam;

import io.github.yok.beam.core.beam.BeamParameterExtractor.Extraction;
import io.github.yok.beam.core.image.IntensityField;
import io.github.yok.beam.core.image.PixelRegion;
import io.github.yok.beam.core.mask.MaskRefiner;
import io.github.yok.beam.core.mask.RefinementResult;
import io.github.yok.beam.core.mask.TerminationReason;
import io.github.yok.beam.core.moment.MomentCalculator;
import io.github.yok.beam.core.moment.MomentSet;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 1 枚の強度分布からビームパラメータを計測するクラスです。
 *
 * <p>
 * モーメント計算 → 楕円マスク反復 → パラメータ抽出をまとめ、診断情報と警告を付けて返します。 状態を持たないため、複数スレッドから同時に呼び出せます。
 * </p>
 */
public final class BeamMeasurer {

    /**
     * モーメント計算ロジックです。
     */
    private final MomentCalculator momentCalculator;

    /**
     * ビームパラメータ抽出ロジックです。
     */
    private final BeamParameterExtractor extractor;

    /**
     * 楕円マスク反復ロジックです。
     */
    private final MaskRefiner maskRefiner;

    /**
     * 計測ロジックを生成します。
     *
     * @param momentCalculator モーメント計算ロジックです（null 不可）
     * @param extractor ビームパラメータ抽出ロジックです（null 不可）
     * @param maskRefiner 楕円マスク反復ロジックです（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public BeamMeasurer(MomentCalculator momentCalculator, BeamParameterExtractor extractor,
            MaskRefiner maskRefiner) {
        if (momentCalculator == null) {
            throw new IllegalArgumentException("momentCalculator は null 不可です");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor は null 不可です");
        }
        if (maskRefiner == null) {
            throw new IllegalArgumentException("maskRefiner は null 不可です");
        }
        this.momentCalculator = momentCalculator;
        this.extractor = extractor;
        this.maskRefiner = maskRefiner;
    }

    /**
     * 画像全体を対象に ISO 11146 の手順で計測します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @return 計測結果です
     */
    public BeamMeasurement measure(IntensityField field) {
        return measure(field, null, null);
    }

    /**
     * 初期領域を指定して計測します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @param crop 初期領域です（null の場合は画像全体）
     * @return 計測結果です
     */
    public BeamMeasurement measure(IntensityField field, PixelRegion crop) {
        return measure(field, crop, null);
    }

    /**
     * 初期領域と固定する向きを指定して計測します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @param crop 初期領域です（null の場合は画像全体）
     * @param fixedPhi 固定する向き（rad）です（null の場合は推定します）
     * @return 計測結果です
     * @throws io.github.yok.beam.core.error.DegenerateInputException 強度総和が 0 の場合に発生します
     */
    public BeamMeasurement measure(IntensityField field, PixelRegion crop, Double fixedPhi) {
        RefinementResult r = maskRefiner.refine(field, crop, fixedPhi);

        Set<MeasurementWarning> warnings = EnumSet.noneOf(MeasurementWarning.class);
        if (r.getTerminationReason() == TerminationReason.ITERATION_LIMIT) {
            warnings.add(MeasurementWarning.CONVERGENCE);
        }
        if (r.getTerminationReason() == TerminationReason.MASK_COLLAPSED) {
            warnings.add(MeasurementWarning.MASK_COLLAPSE);
        }
        if (r.isClamped()) {
            warnings.add(MeasurementWarning.NUMERIC_INSTABILITY);
        }

        return new BeamMeasurement(r.getParameters(), r.getIterations(), r.getTerminationReason(),
                Collections.unmodifiableSet(warnings), r.getMaskCollapse(), r.getHistory());
    }

    /**
     * マスク反復を行わず、領域全体のモーメントだけで計測します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @param crop 領域です（null の場合は画像全体）
     * @return 計測結果です（反復回数 0、終了理由 {@link TerminationReason#NOT_REFINED}）
     * @throws io.github.yok.beam.core.error.DegenerateInputException 強度総和が 0 の場合に発生します
     */
    public BeamMeasurement measureRaw(IntensityField field, PixelRegion crop) {
        MomentSet moments = momentCalculator.compute(field, crop);
        Extraction e = extractor.extract(moments);

        Set<MeasurementWarning> warnings = e.isClamped()
                ? EnumSet.of(MeasurementWarning.NUMERIC_INSTABILITY)
                : EnumSet.noneOf(MeasurementWarning.class);

        return new BeamMeasurement(e.getParameters(), 0, TerminationReason.NOT_REFINED,
                Collections.unmodifiableSet(warnings), null, List.of(e.getParameters()));
    }
}
