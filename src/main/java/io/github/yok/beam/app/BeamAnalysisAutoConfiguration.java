package io.github.yok.beam.app;

import io.github.yok.beam.core.beam.BeamMeasurer;
import io.github.yok.beam.core.beam.BeamParameterExtractor;
import io.github.yok.beam.core.image.BackgroundNormalizer;
import io.github.yok.beam.core.linearalgebra.EjmlLeastSquaresBackend;
import io.github.yok.beam.core.linearalgebra.LeastSquaresBackend;
import io.github.yok.beam.core.mask.MaskRefiner;
import io.github.yok.beam.core.moment.MomentCalculator;
import io.github.yok.beam.core.propagation.CausticAnalyzer;
import io.github.yok.beam.core.propagation.M2CurveFitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * ビーム計測・M² フィット一式の Bean 定義を行う自動設定クラスです。
 *
 * <p>
 * 設定値（beam.*）から楕円マスク反復と M² フィットを組み立てます。利用側で同じ型の Bean を定義した場合はそちらを優先します。
 * </p>
 */
@Slf4j
@AutoConfiguration
@RequiredArgsConstructor
@EnableConfigurationProperties(BeamProperties.class)
public class BeamAnalysisAutoConfiguration {

    /**
     * ビーム計測の設定値（beam.*）です。
     */
    private final BeamProperties p;

    /**
     * 背景差し引きロジックを生成します。
     *
     * @return 背景差し引きロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public BackgroundNormalizer backgroundNormalizer() {
        return new BackgroundNormalizer();
    }

    /**
     * モーメント計算ロジックを生成します。
     *
     * @return モーメント計算ロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public MomentCalculator momentCalculator() {
        return new MomentCalculator();
    }

    /**
     * ビームパラメータ抽出ロジックを生成します。
     *
     * @return 抽出ロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public BeamParameterExtractor beamParameterExtractor() {
        return new BeamParameterExtractor();
    }

    /**
     * 楕円マスク反復ロジックを生成します。
     *
     * @param momentCalculator モーメント計算ロジックです
     * @param extractor 抽出ロジックです
     * @return マスク反復ロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public MaskRefiner maskRefiner(MomentCalculator momentCalculator,
            BeamParameterExtractor extractor) {
        log.info("ビーム計測の設定値:{}", p.toMultilineString());
        return new MaskRefiner(momentCalculator, extractor, p.getMask());
    }

    /**
     * 1 枚の画像の計測ロジックを生成します。
     *
     * @param momentCalculator モーメント計算ロジックです
     * @param extractor 抽出ロジックです
     * @param maskRefiner マスク反復ロジックです
     * @return 計測ロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public BeamMeasurer beamMeasurer(MomentCalculator momentCalculator,
            BeamParameterExtractor extractor, MaskRefiner maskRefiner) {
        return new BeamMeasurer(momentCalculator, extractor, maskRefiner);
    }

    /**
     * 線形最小二乗バックエンドを生成します。
     *
     * @return 線形最小二乗バックエンドです
     */
    @Bean
    @ConditionalOnMissingBean
    public LeastSquaresBackend leastSquaresBackend() {
        return new EjmlLeastSquaresBackend();
    }

    /**
     * M² フィットロジックを生成します。
     *
     * @param backend 線形最小二乗バックエンドです
     * @return M² フィットロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public M2CurveFitter m2CurveFitter(LeastSquaresBackend backend) {
        return new M2CurveFitter(backend, p.getFit());
    }

    /**
     * 画像列から M² を求めるロジックを生成します。
     *
     * @param measurer 計測ロジックです
     * @param fitter M² フィットロジックです
     * @return 画像列の解析ロジックです
     */
    @Bean
    @ConditionalOnMissingBean
    public CausticAnalyzer causticAnalyzer(BeamMeasurer measurer, M2CurveFitter fitter) {
        return new CausticAnalyzer(measurer, fitter, p.getMeasurement().getPixelSize());
    }
}
