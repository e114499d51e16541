package io.github.yok.beam.core.propagation;

import com.google.common.base.Preconditions;
import io.github.yok.beam.app.BeamProperties;
import io.github.yok.beam.core.error.FitConvergenceException;
import io.github.yok.beam.core.error.InsufficientDataException;
import io.github.yok.beam.core.linearalgebra.LeastSquaresBackend;
import io.github.yok.beam.core.linearalgebra.LeastSquaresBackend.LeastSquaresSolution;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.ejml.data.DMatrixRMaj;

/**
 * 直径の伝搬データから M²・ウエスト径・ウエスト位置・広がり角を求めるクラスです。
 *
 * <p>
 * モデル {@code d(z)² = d0² + Θ² (z - z0)²}（{@code Θ = 4 M² λ / (π d0)}）を、d² の残差二乗和が最小になるように
 * Levenberg-Marquardt 法でフィットします。初期値は z の二次式の線形最小二乗から求めます。
 * </p>
 */
@Getter
@Slf4j
public final class M2CurveFitter {

    /**
     * フィットに必要な異なる z 位置の数です。
     */
    public static final int MIN_DISTINCT_POSITIONS = 3;

    /**
     * ISO 11146 が推奨するサンプル数です。
     */
    static final int ISO_MIN_SAMPLES = 10;

    /**
     * ISO 11146 が推奨する、近視野・遠視野それぞれのサンプル数です。
     */
    static final int ISO_MIN_SAMPLES_PER_REGION = 5;

    /**
     * 共分散行列の計算で特異とみなす閾値です。
     */
    private static final double SINGULARITY_THRESHOLD = 1e-14;

    /**
     * 初期値推定に使う線形最小二乗バックエンドです。
     */
    private final LeastSquaresBackend leastSquaresBackend;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * モデル評価回数の上限です。
     */
    private final int maxEvaluations;

    /**
     * コストの相対許容誤差です。
     */
    private final double costRelativeTolerance;

    /**
     * パラメータの相対許容誤差です。
     */
    private final double parameterRelativeTolerance;

    /**
     * M² フィットロジックを生成します。
     *
     * @param leastSquaresBackend 線形最小二乗バックエンドです（null 不可）
     * @param fit フィット設定です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public M2CurveFitter(LeastSquaresBackend leastSquaresBackend, BeamProperties.Fit fit) {
        if (leastSquaresBackend == null) {
            throw new IllegalArgumentException("leastSquaresBackend は null 不可です");
        }
        if (fit == null) {
            throw new IllegalArgumentException("fit は null 不可です");
        }
        if (fit.getMaxIterations() <= 0) {
            throw new IllegalArgumentException("fit.maxIterations は 1 以上が必要です: " + fit.getMaxIterations());
        }
        if (fit.getMaxEvaluations() <= 0) {
            throw new IllegalArgumentException(
                    "fit.maxEvaluations は 1 以上が必要です: " + fit.getMaxEvaluations());
        }
        if (!(fit.getCostRelativeTolerance() > 0.0)) {
            throw new IllegalArgumentException(
                    "fit.costRelativeTolerance は 0 より大きい必要があります: " + fit.getCostRelativeTolerance());
        }
        if (!(fit.getParameterRelativeTolerance() > 0.0)) {
            throw new IllegalArgumentException("fit.parameterRelativeTolerance は 0 より大きい必要があります: "
                    + fit.getParameterRelativeTolerance());
        }
        this.leastSquaresBackend = leastSquaresBackend;
        this.maxIterations = fit.getMaxIterations();
        this.maxEvaluations = fit.getMaxEvaluations();
        this.costRelativeTolerance = fit.getCostRelativeTolerance();
        this.parameterRelativeTolerance = fit.getParameterRelativeTolerance();
    }

    /**
     * M² フィットを実行します。
     *
     * @param samples 伝搬サンプルです（null 不可、同じ横方向軸の直径）
     * @param wavelength 波長 λ です（正、z・d と同じ長さの単位）
     * @return フィット結果です
     * @throws NullPointerException samples が null の場合
     * @throws IllegalArgumentException 波長が正でない、またはサンプルに非有限値・負の直径が含まれる場合
     * @throws InsufficientDataException 異なる z 位置が 3 未満の場合
     * @throws FitConvergenceException 最適化が上限回数内に収束しない場合
     */
    public M2FitResult fit(List<PropagationSample> samples, double wavelength) {
        Preconditions.checkNotNull(samples, "サンプルが null です。");
        Preconditions.checkArgument(wavelength > 0.0 && Double.isFinite(wavelength),
                "波長は正の有限値である必要があります。λ=%s", wavelength);

        Set<Double> distinct = new HashSet<>();
        for (PropagationSample s : samples) {
            Preconditions.checkNotNull(s, "サンプルに null が含まれています。");
            Preconditions.checkArgument(Double.isFinite(s.getZ()) && Double.isFinite(s.getDiameter()),
                    "サンプルは有限値である必要があります。z=%s, d=%s", s.getZ(), s.getDiameter());
            Preconditions.checkArgument(s.getDiameter() >= 0.0, "直径は 0 以上である必要があります。d=%s",
                    s.getDiameter());
            // -0.0 と 0.0 は同じ位置
            distinct.add(s.getZ() == 0.0 ? 0.0 : s.getZ());
        }
        if (distinct.size() < MIN_DISTINCT_POSITIONS) {
            throw new InsufficientDataException("M² フィットには異なる z 位置が " + MIN_DISTINCT_POSITIONS
                    + " 点以上必要です: samples=" + samples.size() + ", distinctZ=" + distinct.size());
        }

        int n = samples.size();
        double[] z = new double[n];
        double[] d2 = new double[n];
        for (int i = 0; i < n; i++) {
            z[i] = samples.get(i).getZ();
            double d = samples.get(i).getDiameter();
            d2[i] = d * d;
        }

        // 1) 初期値（d0, z0, Θ）
        double[] start = initialEstimate(samples, z, d2);

        log.info("M²フィットを開始します。サンプル数={}、λ={}、初期値 d0={} z0={} Θ={}", n, fmt5(wavelength),
                fmt5(start[0]), fmt5(start[1]), fmt5(start[2]));

        // 2) d² の残差で Levenberg-Marquardt
        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .model(new SquaredDiameterModel(z))
                .target(d2)
                .start(start)
                .maxIterations(maxIterations)
                .maxEvaluations(maxEvaluations)
                .lazyEvaluation(false)
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(costRelativeTolerance)
                .withParameterRelativeTolerance(parameterRelativeTolerance);

        Optimum optimum;
        try {
            optimum = optimizer.optimize(problem);
        } catch (TooManyIterationsException | TooManyEvaluationsException e) {
            throw new FitConvergenceException(
                    "M² フィットが上限回数内に収束しませんでした: maxIterations=" + maxIterations, e);
        } catch (ConvergenceException e) {
            throw new FitConvergenceException("M² フィットが収束しませんでした: " + e.getMessage(), e);
        }

        double[] p = optimum.getPoint().toArray();
        if (!Double.isFinite(p[0]) || !Double.isFinite(p[1]) || !Double.isFinite(p[2])) {
            throw new FitConvergenceException("M² フィットの結果が有限値ではありません: d0=" + p[0] + ", z0="
                    + p[1] + ", Θ=" + p[2]);
        }

        // 3) 派生量（モデルは d0, Θ について偶関数のため絶対値を採用）
        double d0 = Math.abs(p[0]);
        double z0 = p[1];
        double theta = Math.abs(p[2]);
        double m2 = Math.PI * d0 * theta / (4.0 * wavelength);
        double zR = (theta > 0.0) ? d0 / theta : Double.POSITIVE_INFINITY;

        // 4) 診断情報
        double rss = optimum.getCost() * optimum.getCost();
        int dof = n - 3;
        double[][] cov = covariance(optimum, rss, dof);
        // 絶対値を取ったパラメータの符号を共分散に反映
        double sign0 = Math.signum(p[0]) == 0.0 ? 1.0 : Math.signum(p[0]);
        double sign2 = Math.signum(p[2]) == 0.0 ? 1.0 : Math.signum(p[2]);
        double covD0Theta = sign0 * sign2 * cov[0][2];

        double errD0 = Math.sqrt(cov[0][0]);
        double errZ0 = Math.sqrt(cov[1][1]);
        double errTheta = Math.sqrt(cov[2][2]);
        double relD0 = errD0 / d0;
        double relTheta = errTheta / theta;
        double relCov = covD0Theta / (d0 * theta);
        double errM2 = m2 * Math.sqrt(Math.max(0.0, relD0 * relD0 + relTheta * relTheta + 2.0 * relCov));
        double errZr = zR * Math.sqrt(Math.max(0.0, relD0 * relD0 + relTheta * relTheta - 2.0 * relCov));

        int within = 0;
        int beyond = 0;
        for (double zi : z) {
            double dz = Math.abs(zi - z0);
            if (dz <= zR) {
                within++;
            }
            if (dz >= 2.0 * zR) {
                beyond++;
            }
        }

        FitDiagnostics diagnostics = new FitDiagnostics(rss, dof, optimum.getIterations(),
                optimum.getEvaluations(), cov, errD0, errZ0, errTheta, errM2, errZr, within, beyond);

        // 5) 妥当性の検証（警告のみ、結果は返す）
        Set<FitWarning> warnings = EnumSet.noneOf(FitWarning.class);
        if (!(d0 > 0.0) || m2 < 1.0) {
            warnings.add(FitWarning.PHYSICALLY_INVALID);
            log.warn("物理的に妥当でないフィット結果です。d0={}、M²={}（M² ≥ 1 が必要）", fmt5(d0), fmt5(m2));
        }
        if (n < ISO_MIN_SAMPLES || within < ISO_MIN_SAMPLES_PER_REGION
                || beyond < ISO_MIN_SAMPLES_PER_REGION) {
            warnings.add(FitWarning.ISO_SAMPLING);
            log.warn("ISO 11146 のサンプリング推奨を満たしていません。サンプル数={}（推奨 {}）、zR以内={}、2zRより外={}（各推奨 {}）", n,
                    ISO_MIN_SAMPLES, within, beyond, ISO_MIN_SAMPLES_PER_REGION);
        }

        log.info("M²フィットが完了しました。反復回数={}、d0={}、z0={}、Θ={}、zR={}、M²={}±{}、RSS={}",
                optimum.getIterations(), fmt5(d0), fmt5(z0), fmt5(theta), fmt5(zR), fmt5(m2),
                fmt5(errM2), fmt5(rss));

        return new M2FitResult(d0, 0.5 * d0, z0, theta, 0.5 * theta, zR, m2, wavelength,
                diagnostics, Collections.unmodifiableSet(warnings));
    }

    /**
     * 初期値 (d0, z0, Θ) を求めます。
     *
     * <p>
     * z を中心化・正規化した変数 t について {@code d² = c0 + c1 t + c2 t²} を線形最小二乗で解き、 頂点から d0, z0
     * を、二次係数から Θ を求めます。二次式が下に凸でない場合は、最小直径とその位置、 両端の傾きから求めます。
     * </p>
     *
     * @param samples 伝搬サンプルです
     * @param z 位置の配列です
     * @param d2 直径の二乗の配列です
     * @return 初期値 (d0, z0, Θ) です
     */
    double[] initialEstimate(List<PropagationSample> samples, double[] z, double[] d2) {
        int n = z.length;
        double zMean = 0.0;
        for (double zi : z) {
            zMean += zi;
        }
        zMean /= n;
        double zScale = 0.0;
        for (double zi : z) {
            zScale = Math.max(zScale, Math.abs(zi - zMean));
        }

        DMatrixRMaj design = new DMatrixRMaj(n, 3);
        for (int i = 0; i < n; i++) {
            double t = (z[i] - zMean) / zScale;
            design.set(i, 0, 1.0);
            design.set(i, 1, t);
            design.set(i, 2, t * t);
        }

        try {
            LeastSquaresSolution sol = leastSquaresBackend.solve(design, d2);
            double c0 = sol.getCoefficients()[0];
            double c1 = sol.getCoefficients()[1];
            double c2 = sol.getCoefficients()[2];
            if (c2 > 0.0) {
                double t0 = -c1 / (2.0 * c2);
                double d0Sq = c0 - c2 * t0 * t0;
                if (d0Sq > 0.0) {
                    double theta = Math.sqrt(c2) / zScale;
                    return new double[] {Math.sqrt(d0Sq), zMean + t0 * zScale, theta};
                }
            }
            log.debug("二次式による初期値推定が不適です（c2={}）。最小直径から初期値を求めます。", c2);
        } catch (IllegalStateException e) {
            log.debug("二次式による初期値推定に失敗しました。最小直径から初期値を求めます。{}", e.getMessage());
        }
        return fallbackEstimate(samples);
    }

    /**
     * 最小直径とその位置、両端の傾きから初期値を求めます。
     *
     * @param samples 伝搬サンプルです
     * @return 初期値 (d0, z0, Θ) です
     */
    private static double[] fallbackEstimate(List<PropagationSample> samples) {
        List<PropagationSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingDouble(PropagationSample::getZ));

        PropagationSample min = sorted.get(0);
        double dMax = 0.0;
        for (PropagationSample s : sorted) {
            if (s.getDiameter() < min.getDiameter()) {
                min = s;
            }
            dMax = Math.max(dMax, s.getDiameter());
        }
        PropagationSample first = sorted.get(0);
        PropagationSample last = sorted.get(sorted.size() - 1);
        double zRange = last.getZ() - first.getZ();

        double d0 = (min.getDiameter() > 0.0) ? min.getDiameter() : Math.max(dMax, 1.0) * 1e-3;
        double theta = Math.abs(last.getDiameter() - first.getDiameter()) / zRange;
        if (!(theta > 0.0)) {
            theta = Math.max(dMax - min.getDiameter(), d0) / zRange;
        }
        return new double[] {d0, min.getZ(), theta};
    }

    /**
     * パラメータの共分散 {@code s² (JᵀJ)⁻¹} を求めます。自由度 0 や特異な場合は NaN で埋めます。
     *
     * @param optimum 最適化結果です
     * @param rss 残差二乗和です
     * @param dof 自由度です
     * @return 3×3 の共分散行列です
     */
    private static double[][] covariance(Optimum optimum, double rss, int dof) {
        double[][] nan = new double[3][3];
        for (double[] row : nan) {
            Arrays.fill(row, Double.NaN);
        }
        if (dof <= 0) {
            return nan;
        }
        try {
            RealMatrix c = optimum.getCovariances(SINGULARITY_THRESHOLD);
            return c.scalarMultiply(rss / dof).getData();
        } catch (SingularMatrixException e) {
            log.warn("ヤコビアンが特異なため共分散を計算できません。{}", e.getMessage());
            return nan;
        }
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

    /**
     * d² のモデル {@code d0² + Θ² (z - z0)²} とそのヤコビアンです。
     */
    private static final class SquaredDiameterModel implements MultivariateJacobianFunction {

        /**
         * 位置の配列です。
         */
        private final double[] z;

        SquaredDiameterModel(double[] z) {
            this.z = z;
        }

        @Override
        public Pair<RealVector, RealMatrix> value(RealVector point) {
            double d0 = point.getEntry(0);
            double z0 = point.getEntry(1);
            double theta = point.getEntry(2);

            double[] values = new double[z.length];
            double[][] jacobian = new double[z.length][3];
            for (int i = 0; i < z.length; i++) {
                double dz = z[i] - z0;
                values[i] = d0 * d0 + theta * theta * dz * dz;
                jacobian[i][0] = 2.0 * d0;
                jacobian[i][1] = -2.0 * theta * theta * dz;
                jacobian[i][2] = 2.0 * theta * dz * dz;
            }
            return new Pair<>(new ArrayRealVector(values, false),
                    new Array2DRowRealMatrix(jacobian, false));
        }
    }
}
