package io.github.yok.beam.core.propagation;

import io.github.yok.beam.core.beam.BeamMeasurement;
import io.github.yok.beam.core.beam.BeamMeasurer;
import io.github.yok.beam.core.beam.BeamParameters;
import io.github.yok.beam.core.image.IntensityField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 光軸上の複数位置で撮影した画像から、長軸・短軸それぞれの M² を求めるクラスです。
 *
 * <p>
 * 各画像を ISO 11146 の手順で計測し、物理単位に換算した長軸直径・短軸直径をそれぞれ独立にフィットします。
 * </p>
 */
@Slf4j
public final class CausticAnalyzer {

    /**
     * 1 枚の画像の計測ロジックです。
     */
    private final BeamMeasurer measurer;

    /**
     * M² フィットロジックです。
     */
    private final M2CurveFitter fitter;

    /**
     * 画素サイズを指定しない場合に使う 1 画素あたりの物理長です。
     */
    private final double defaultPixelSize;

    /**
     * 画像列の解析ロジックを生成します。
     *
     * @param measurer 1 枚の画像の計測ロジックです（null 不可）
     * @param fitter M² フィットロジックです（null 不可）
     * @param defaultPixelSize 既定の 1 画素あたりの物理長です（正の有限値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CausticAnalyzer(BeamMeasurer measurer, M2CurveFitter fitter, double defaultPixelSize) {
        if (measurer == null) {
            throw new IllegalArgumentException("measurer は null 不可です");
        }
        if (fitter == null) {
            throw new IllegalArgumentException("fitter は null 不可です");
        }
        checkPixelSize(defaultPixelSize);
        this.measurer = measurer;
        this.fitter = fitter;
        this.defaultPixelSize = defaultPixelSize;
    }

    /**
     * 既定の画素サイズで画像列を計測し、長軸・短軸の M² をフィットします。
     *
     * @param positions 各画像の光軸上の位置です（null 不可）
     * @param images 各位置の非負の強度分布です（null 不可、positions と同じ長さ）
     * @param wavelength 波長 λ です（正）
     * @return 計測結果とフィット結果です
     */
    public CausticResult analyze(List<Double> positions, List<IntensityField> images,
            double wavelength) {
        return analyze(positions, images, defaultPixelSize, wavelength);
    }

    /**
     * 画像列を計測し、長軸・短軸の M² をフィットします。
     *
     * @param positions 各画像の光軸上の位置です（null 不可）
     * @param images 各位置の非負の強度分布です（null 不可、positions と同じ長さ）
     * @param pixelSize 1 画素あたりの物理長です（正、z・λ と同じ長さの単位）
     * @param wavelength 波長 λ です（正）
     * @return 計測結果とフィット結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CausticResult analyze(List<Double> positions, List<IntensityField> images,
            double pixelSize, double wavelength) {
        if (positions == null || images == null) {
            throw new IllegalArgumentException("positions/images は null 不可です");
        }
        if (positions.size() != images.size()) {
            throw new IllegalArgumentException("positions と images の長さが一致しません: "
                    + positions.size() + " vs " + images.size());
        }
        checkPixelSize(pixelSize);

        List<BeamMeasurement> measurements = new ArrayList<>(images.size());
        List<BeamParameters> physical = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            BeamMeasurement m = measurer.measure(images.get(i));
            if (!m.getWarnings().isEmpty()) {
                log.warn("画像 {} / {}（z={}）の計測に警告があります: {}", i + 1, images.size(),
                        positions.get(i), m.getWarnings());
            }
            measurements.add(m);
            physical.add(m.inPhysicalUnits(pixelSize));
        }

        AxisFits fits = fitAxes(positions, physical, wavelength);
        return new CausticResult(Collections.unmodifiableList(measurements), fits.getMajor(),
                fits.getMinor());
    }

    /**
     * 計測済みのビームパラメータから、長軸・短軸の M² をフィットします。
     *
     * @param positions 光軸上の位置です（null 不可）
     * @param parameters 各位置のビームパラメータ（物理単位）です（null 不可、positions と同じ長さ）
     * @param wavelength 波長 λ です（正）
     * @return 長軸・短軸のフィット結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public AxisFits fitAxes(List<Double> positions, List<BeamParameters> parameters,
            double wavelength) {
        if (positions == null || parameters == null) {
            throw new IllegalArgumentException("positions/parameters は null 不可です");
        }
        if (positions.size() != parameters.size()) {
            throw new IllegalArgumentException("positions と parameters の長さが一致しません: "
                    + positions.size() + " vs " + parameters.size());
        }

        List<PropagationSample> major = new ArrayList<>(positions.size());
        List<PropagationSample> minor = new ArrayList<>(positions.size());
        for (int i = 0; i < positions.size(); i++) {
            Double z = positions.get(i);
            if (z == null) {
                throw new IllegalArgumentException("positions に null が含まれています");
            }
            BeamParameters p = parameters.get(i);
            major.add(new PropagationSample(z, p.getDMajor()));
            minor.add(new PropagationSample(z, p.getDMinor()));
        }

        log.info("長軸方向の M² をフィットします。");
        M2FitResult majorFit = fitter.fit(major, wavelength);
        log.info("短軸方向の M² をフィットします。");
        M2FitResult minorFit = fitter.fit(minor, wavelength);
        return new AxisFits(majorFit, minorFit);
    }

    private static void checkPixelSize(double pixelSize) {
        if (!(pixelSize > 0.0) || Double.isInfinite(pixelSize)) {
            throw new IllegalArgumentException("pixelSize は正の有限値が必要です: " + pixelSize);
        }
    }

    /**
     * 長軸・短軸のフィット結果です。
     */
    @Value
    public static class AxisFits {

        /**
         * 長軸直径のフィット結果です。
         */
        M2FitResult major;

        /**
         * 短軸直径のフィット結果です。
         */
        M2FitResult minor;
    }

    /**
     * 画像列の計測結果とフィット結果です。
     */
    @Value
    public static class CausticResult {

        /**
         * 各画像の計測結果（画素単位）です。
         */
        List<BeamMeasurement> measurements;

        /**
         * 長軸直径のフィット結果です。
         */
        M2FitResult major;

        /**
         * 短軸直径のフィット結果です。
         */
        M2FitResult minor;
    }
}
