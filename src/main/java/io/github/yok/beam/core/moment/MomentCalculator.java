package io.github.yok.beam.core.moment;

import io.github.yok.beam.core.error.DegenerateInputException;
import io.github.yok.beam.core.image.IntensityField;
import io.github.yok.beam.core.image.PixelRegion;

/**
 * 矩形領域（とマスク）内の強度重み付き重心・二次中心モーメントを計算するクラスです。
 *
 * <p>
 * 1 パス目で重心、2 パス目で重心まわりの二次モーメントを求めます。入力は変更せず、状態も持ちません。
 * </p>
 */
public final class MomentCalculator {

    /**
     * 矩形領域内のモーメントを計算します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @param region 矩形領域です（null の場合は全体、画像外は切り詰めます）
     * @return モーメントです
     * @throws DegenerateInputException 強度総和が 0 以下、または有限値でない場合に発生します
     */
    public MomentSet compute(IntensityField field, PixelRegion region) {
        return compute(field, region, null);
    }

    /**
     * 矩形領域内かつマスク内の画素についてモーメントを計算します。
     *
     * @param field 非負の強度分布です（null 不可）
     * @param region 矩形領域です（null の場合は全体、画像外は切り詰めます）
     * @param mask マスクです（null の場合は矩形領域全体）
     * @return モーメントです
     * @throws IllegalArgumentException field が null の場合に発生します
     * @throws DegenerateInputException 強度総和が 0 以下、または有限値でない場合に発生します
     */
    public MomentSet compute(IntensityField field, PixelRegion region, PixelMask mask) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        PixelRegion r = field.clip(region);
        if (mask != null) {
            r = r.intersect(mask.bounds());
        }

        // 1) 総和と重心
        double sum = 0.0;
        double sumX = 0.0;
        double sumY = 0.0;
        long count = 0;
        for (int y = r.getY0(); y < r.getY1(); y++) {
            for (int x = r.getX0(); x < r.getX1(); x++) {
                if (mask != null && !mask.contains(x, y)) {
                    continue;
                }
                double p = field.get(x, y);
                sum += p;
                sumX += p * x;
                sumY += p * y;
                count++;
            }
        }

        if (!(sum > 0.0) || !Double.isFinite(sum)) {
            throw new DegenerateInputException("強度の総和が 0 以下のため重心を計算できません: total=" + sum
                    + ", pixels=" + count);
        }

        double xc = sumX / sum;
        double yc = sumY / sum;

        // 2) 重心まわりの二次モーメント
        double sxx = 0.0;
        double syy = 0.0;
        double sxy = 0.0;
        for (int y = r.getY0(); y < r.getY1(); y++) {
            double dy = y - yc;
            for (int x = r.getX0(); x < r.getX1(); x++) {
                if (mask != null && !mask.contains(x, y)) {
                    continue;
                }
                double p = field.get(x, y);
                double dx = x - xc;
                sxx += p * dx * dx;
                syy += p * dy * dy;
                sxy += p * dx * dy;
            }
        }

        return new MomentSet(sum, xc, yc, sxx / sum, syy / sum, sxy / sum, count);
    }
}
