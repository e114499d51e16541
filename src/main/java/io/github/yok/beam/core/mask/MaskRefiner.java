package io.github.yok.beam.core.mask;

import io.github.yok.beam.app.BeamProperties;
import io.github.yok.beam.core.beam.BeamParameterExtractor;
import io.github.yok.beam.core.beam.BeamParameterExtractor.AxisDiameters;
import io.github.yok.beam.core.beam.BeamParameterExtractor.Extraction;
import io.github.yok.beam.core.beam.BeamParameters;
import io.github.yok.beam.core.error.DegenerateInputException;
import io.github.yok.beam.core.error.MaskCollapseException;
import io.github.yok.beam.core.image.IntensityField;
import io.github.yok.beam.core.image.PixelRegion;
import io.github.yok.beam.core.moment.MomentCalculator;
import io.github.yok.beam.core.moment.MomentSet;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * ISO 11146 の楕円マスク反復で、背景ノイズに頑健なモーメントを求めるクラスです。
 *
 * <p>
 * 現在の推定値 → 楕円マスク構築 → マスク内モーメント再計算 → 収束判定、を反復します。
 * 楕円の半軸は {@code 直径倍率 × 現在の直径 / 2}、向きは現在の φ（または固定値）です。
 * </p>
 */
@Getter
@Slf4j
public final class MaskRefiner {

    /**
     * モーメント計算ロジックです。
     */
    private final MomentCalculator momentCalculator;

    /**
     * ビームパラメータ抽出ロジックです。
     */
    private final BeamParameterExtractor extractor;

    /**
     * 楕円マスクの直径倍率です。
     */
    private final double maskDiameterMultiplier;

    /**
     * 収束判定の相対変化量です。
     */
    private final double relativeTolerance;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * マスク崩壊とみなす強度比です。
     */
    private final double collapseFraction;

    /**
     * マスク反復ロジックを生成します。
     *
     * @param momentCalculator モーメント計算ロジックです（null 不可）
     * @param extractor ビームパラメータ抽出ロジックです（null 不可）
     * @param mask マスク設定です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public MaskRefiner(MomentCalculator momentCalculator, BeamParameterExtractor extractor,
            BeamProperties.Mask mask) {
        if (momentCalculator == null) {
            throw new IllegalArgumentException("momentCalculator は null 不可です");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor は null 不可です");
        }
        if (mask == null) {
            throw new IllegalArgumentException("mask は null 不可です");
        }

        double multiplier = mask.getMaskDiameterMultiplier();
        double tol = mask.getRelativeTolerance();
        int maxIter = mask.getMaxIterations();
        double collapse = mask.getCollapseFraction();

        if (!(multiplier > 0.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException(
                    "mask.maskDiameterMultiplier は正の有限値が必要です: " + multiplier);
        }
        if (!(tol > 0.0)) {
            throw new IllegalArgumentException("mask.relativeTolerance は 0 より大きい必要があります: " + tol);
        }
        if (maxIter <= 0) {
            throw new IllegalArgumentException("mask.maxIterations は 1 以上が必要です: " + maxIter);
        }
        if (!(collapse >= 0.0 && collapse < 1.0)) {
            throw new IllegalArgumentException("mask.collapseFraction は [0, 1) が必要です: " + collapse);
        }

        this.momentCalculator = momentCalculator;
        this.extractor = extractor;
        this.maskDiameterMultiplier = multiplier;
        this.relativeTolerance = tol;
        this.maxIterations = maxIter;
        this.collapseFraction = collapse;
    }

    /**
     * 画像全体を初期領域としてマスク反復を実行します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @return 反復結果です
     * @throws DegenerateInputException 初期領域の強度総和が 0 の場合に発生します
     */
    public RefinementResult refine(IntensityField field) {
        return refine(field, null, null);
    }

    /**
     * マスク反復を実行します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @param crop 初期領域です（null の場合は画像全体）
     * @param fixedPhi 固定する向き（rad）です（null の場合は毎反復で推定します）
     * @return 反復結果です
     * @throws IllegalArgumentException field が null の場合に発生します
     * @throws DegenerateInputException 初期領域の強度総和が 0 の場合に発生します
     */
    public RefinementResult refine(IntensityField field, PixelRegion crop, Double fixedPhi) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        PixelRegion region = field.clip(crop);

        // 初期状態：領域全体のモーメント（ここで強度 0 なら回復不能）
        MomentSet initial = momentCalculator.compute(field, region);
        Extraction first = extract(initial, fixedPhi);
        RefinementState state = new RefinementState(initial, first.getParameters(), first.isClamped());

        double collapseThreshold = collapseFraction * initial.getTotalIntensity();
        MaskCollapseException collapse = null;

        log.debug("マスク反復を開始します。画像={}x{}、直径倍率={}、許容相対変化={}、最大反復={}、初期直径=({}, {})",
                field.width(), field.height(), fmt5(maskDiameterMultiplier),
                fmt5(relativeTolerance), maxIterations, fmt5(first.getParameters().getDMajor()),
                fmt5(first.getParameters().getDMinor()));

        while (!state.isTerminated()) {
            int iter = state.getIteration() + 1;

            // 1) 現在の推定値から楕円マスクを構築
            EllipticalMask mask = buildMask(state.getMoments(), state.getParameters(), fixedPhi);

            // 2) マスク内のモーメントを再計算
            MomentSet next;
            try {
                next = momentCalculator.compute(field, region, mask);
            } catch (DegenerateInputException e) {
                collapse = new MaskCollapseException(iter, 0.0, e);
                state.terminate(TerminationReason.MASK_COLLAPSED);
                break;
            }
            if (next.getTotalIntensity() <= collapseThreshold) {
                collapse = new MaskCollapseException(iter, next.getTotalIntensity(), null);
                state.terminate(TerminationReason.MASK_COLLAPSED);
                break;
            }

            // 3) 状態更新と収束判定
            Extraction extraction = extract(next, fixedPhi);
            double change =
                    state.advance(next, extraction.getParameters(), extraction.isClamped());

            log.debug("マスク反復 {} / {}：重心=({}, {})、直径=({}, {})、相対変化={}", iter, maxIterations,
                    fmt5(extraction.getParameters().getXc()),
                    fmt5(extraction.getParameters().getYc()),
                    fmt5(extraction.getParameters().getDMajor()),
                    fmt5(extraction.getParameters().getDMinor()), fmt5(change));

            if (change < relativeTolerance) {
                state.terminate(TerminationReason.CONVERGED);
            } else if (state.getIteration() >= maxIterations) {
                state.terminate(TerminationReason.ITERATION_LIMIT);
            }
        }

        switch (state.getTerminationReason()) {
            case CONVERGED:
                log.debug("マスク反復が収束しました。反復回数={}、相対変化={}", state.getIteration(),
                        fmt5(state.getLastRelativeChange()));
                break;
            case ITERATION_LIMIT:
                log.warn("マスク反復が未収束で終了しました。反復回数={}、相対変化={}（許容={}）", state.getIteration(),
                        fmt5(state.getLastRelativeChange()), fmt5(relativeTolerance));
                break;
            default:
                log.warn("マスク内の強度が不足したため、直前の推定値を採用します。{}", collapse.getMessage());
                break;
        }

        return new RefinementResult(state.getMoments(), state.getParameters(), state.getIteration(),
                state.getTerminationReason(), state.getLastRelativeChange(), state.isClamped(),
                collapse, state.getHistory());
    }

    /**
     * 現在の推定値から楕円マスクを構築します。
     *
     * @param moments 現在のモーメントです
     * @param current 現在のビームパラメータです
     * @param fixedPhi 固定する向きです（null 可）
     * @return 楕円マスクです
     */
    EllipticalMask buildMask(MomentSet moments, BeamParameters current, Double fixedPhi) {
        double phi;
        double along;
        double across;
        if (fixedPhi == null) {
            phi = current.getPhi();
            along = current.getDMajor();
            across = current.getDMinor();
        } else {
            // 向き固定時は固定方向とその直交方向の直径で楕円を作る
            phi = fixedPhi;
            AxisDiameters axes = extractor.diametersAlong(moments, fixedPhi);
            along = axes.getAlong();
            across = axes.getAcross();
        }
        double k = 0.5 * maskDiameterMultiplier;
        return new EllipticalMask(current.getXc(), current.getYc(), k * along, k * across, phi);
    }

    private Extraction extract(MomentSet moments, Double fixedPhi) {
        return (fixedPhi == null) ? extractor.extract(moments)
                : extractor.extract(moments, fixedPhi);
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
