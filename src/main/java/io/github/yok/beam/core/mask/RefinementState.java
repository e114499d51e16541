package io.github.yok.beam.core.mask;

import io.github.yok.beam.core.beam.BeamParameters;
import io.github.yok.beam.core.moment.MomentSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * マスク反復の状態（現在のモーメント・反復回数・終了理由）を保持するクラスです。
 *
 * <p>
 * 1 回の {@link MaskRefiner#refine} 呼び出しの間だけ使用し、呼び出しをまたいで共有しません。
 * </p>
 */
@Getter
public final class RefinementState {

    /**
     * 現在（最後に有効だった）モーメントです。
     */
    private MomentSet moments;

    /**
     * 現在のビームパラメータです。
     */
    private BeamParameters parameters;

    /**
     * 現在のビームパラメータで負の固有値を切り詰めたかどうかです。
     */
    private boolean clamped;

    /**
     * 完了したマスク反復の回数です（初期状態は 0）。
     */
    private int iteration;

    /**
     * 直前の反復での相対変化量です。
     */
    private double lastRelativeChange = Double.POSITIVE_INFINITY;

    /**
     * 終了理由です（反復中は null）。
     */
    private TerminationReason terminationReason;

    /**
     * 反復 0（初期状態）からのビームパラメータの履歴です。
     */
    private final List<BeamParameters> history = new ArrayList<>();

    /**
     * 初期状態を生成します。
     *
     * @param moments 初期モーメントです
     * @param parameters 初期ビームパラメータです
     * @param clamped 負の固有値を切り詰めたかどうかです
     */
    RefinementState(MomentSet moments, BeamParameters parameters, boolean clamped) {
        this.moments = moments;
        this.parameters = parameters;
        this.clamped = clamped;
        this.history.add(parameters);
    }

    /**
     * 次の反復結果で状態を更新します。
     *
     * @param nextMoments 新しいモーメントです
     * @param nextParameters 新しいビームパラメータです
     * @param nextClamped 負の固有値を切り詰めたかどうかです
     * @return 更新前との相対変化量です
     */
    double advance(MomentSet nextMoments, BeamParameters nextParameters, boolean nextClamped) {
        double change = relativeChange(parameters, nextParameters);
        this.moments = nextMoments;
        this.parameters = nextParameters;
        this.clamped = nextClamped;
        this.iteration++;
        this.lastRelativeChange = change;
        this.history.add(nextParameters);
        return change;
    }

    /**
     * 反復を終了します。
     *
     * @param reason 終了理由です
     */
    void terminate(TerminationReason reason) {
        this.terminationReason = reason;
    }

    /**
     * 反復が終了しているかどうかを返します。
     *
     * @return 終了していれば true です
     */
    public boolean isTerminated() {
        return terminationReason != null;
    }

    /**
     * 履歴の読み取り専用ビューを返します。
     *
     * @return 履歴です
     */
    public List<BeamParameters> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * 重心・直径の相対変化量の最大値を返します。
     *
     * <p>
     * 直径は直前の直径、重心は直前の長軸直径を基準とします（基準は最小 1 画素）。
     * </p>
     *
     * @param prev 直前の値です
     * @param next 新しい値です
     * @return 相対変化量の最大値です
     */
    static double relativeChange(BeamParameters prev, BeamParameters next) {
        double scaleMajor = Math.max(prev.getDMajor(), 1.0);
        double scaleMinor = Math.max(prev.getDMinor(), 1.0);
        double dMajor = Math.abs(next.getDMajor() - prev.getDMajor()) / scaleMajor;
        double dMinor = Math.abs(next.getDMinor() - prev.getDMinor()) / scaleMinor;
        double dx = Math.abs(next.getXc() - prev.getXc()) / scaleMajor;
        double dy = Math.abs(next.getYc() - prev.getYc()) / scaleMajor;
        return Math.max(Math.max(dMajor, dMinor), Math.max(dx, dy));
    }
}
