package io.github.yok.spectral.core.table;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 吸収断面積テーブル（データセット energy と cross_section）の内容です。
 *
 * <p>
 * energy はグリッドの範囲を決めるだけで、チャネル数は cross_section の長さで決まります。 断面積の単位は cm^2 です。
 * </p>
 */
public final class CrossSectionTable {

    /**
     * エネルギー（keV）です。
     */
    private final double[] energy;

    /**
     * チャネルごとの断面積（cm^2）です。
     */
    private final double[] crossSection;

    /**
     * 断面積テーブルを生成します。
     *
     * @param energy エネルギー（keV）です（2 点以上）
     * @param crossSection 断面積（cm^2）です（1 点以上）
     */
    public CrossSectionTable(double[] energy, double[] crossSection) {
        checkNotNull(energy, "energy は null 不可です");
        checkNotNull(crossSection, "crossSection は null 不可です");
        checkArgument(energy.length >= 2, "energy は 2 点以上が必要です: %s", energy.length);
        checkArgument(crossSection.length >= 1, "cross_section が空です");
        for (int i = 0; i < crossSection.length; i++) {
            if (!(crossSection[i] >= 0.0 && Double.isFinite(crossSection[i]))) {
                throw new IllegalArgumentException(
                        "cross_section は 0 以上の有限値が必要です: [" + i + "]=" + crossSection[i]);
            }
        }
        this.energy = energy.clone();
        this.crossSection = crossSection.clone();
    }

    /**
     * エネルギーの最小値を返します。
     *
     * @return 最小エネルギー（keV）です
     */
    public double minEnergy() {
        double m = Double.POSITIVE_INFINITY;
        for (double e : energy) {
            m = Math.min(m, e);
        }
        return m;
    }

    /**
     * エネルギーの最大値を返します。
     *
     * @return 最大エネルギー（keV）です
     */
    public double maxEnergy() {
        double m = Double.NEGATIVE_INFINITY;
        for (double e : energy) {
            m = Math.max(m, e);
        }
        return m;
    }

    /**
     * チャネル数（断面積の点数）を返します。
     *
     * @return チャネル数です
     */
    public int channelCount() {
        return crossSection.length;
    }

    /**
     * 断面積（コピー）を返します。
     *
     * @return 断面積（cm^2）です
     */
    public double[] crossSection() {
        return crossSection.clone();
    }
}
