package io.github.yok.spectral.core.grid;

import io.github.yok.spectral.core.error.InvalidRangeException;
import java.util.Locale;

/**
 * 全スペクトルモデルで共有する線形エネルギーグリッドを表すクラスです。
 *
 * <p>
 * エネルギーの単位は keV です。ビン端は {@code emin} から {@code emax} までの等間隔で、 最後のビン端は {@code emax}
 * そのものに固定します。
 * </p>
 */
public final class EnergyGrid {

    /**
     * 最小エネルギー（keV）です。
     */
    private final double emin;

    /**
     * 最大エネルギー（keV）です。
     */
    private final double emax;

    /**
     * チャネル数です。
     */
    private final int nchan;

    /**
     * ビン端（長さ nchan+1、狭義単調増加）です。
     */
    private final double[] binEdges;

    /**
     * ビン幅（長さ nchan）です。
     */
    private final double[] binWidths;

    /**
     * ビン中心（長さ nchan）です。
     */
    private final double[] binCenters;

    /**
     * エネルギーグリッドを生成します。
     *
     * @param emin 最小エネルギー（keV）です
     * @param emax 最大エネルギー（keV）です
     * @param nchan チャネル数です（1 以上）
     * @throws InvalidRangeException emax &lt;= emin、nchan &lt;= 0、非有限値、またはビン端が狭義単調増加にならない場合に発生します
     */
    public EnergyGrid(double emin, double emax, int nchan) {
        if (!Double.isFinite(emin) || !Double.isFinite(emax)) {
            throw new InvalidRangeException(
                    "emin/emax は有限値を指定してください: emin=" + emin + ", emax=" + emax);
        }
        if (emax <= emin) {
            throw new InvalidRangeException(
                    "emax は emin より大きい必要があります: emin=" + emin + ", emax=" + emax);
        }
        if (nchan <= 0) {
            throw new InvalidRangeException("nchan は 1 以上が必要です: " + nchan);
        }
        this.emin = emin;
        this.emax = emax;
        this.nchan = nchan;

        double step = (emax - emin) / nchan;
        if (!Double.isFinite(step)) {
            throw new InvalidRangeException(
                    "ビン幅が有限値になりません: emin=" + emin + ", emax=" + emax + ", nchan=" + nchan);
        }
        this.binEdges = new double[nchan + 1];
        for (int i = 0; i < nchan; i++) {
            binEdges[i] = emin + i * step;
        }
        binEdges[nchan] = emax;
        // 幅が倍精度の分解能を下回るとビン端が重なる
        for (int i = 0; i < nchan; i++) {
            if (!(binEdges[i + 1] > binEdges[i])) {
                throw new InvalidRangeException("ビン端が狭義単調増加になりません（分解能不足）: emin=" + emin
                        + ", emax=" + emax + ", nchan=" + nchan + ", edge[" + i + "]=" + binEdges[i]);
            }
        }

        this.binWidths = new double[nchan];
        this.binCenters = new double[nchan];
        for (int i = 0; i < nchan; i++) {
            binWidths[i] = binEdges[i + 1] - binEdges[i];
            binCenters[i] = 0.5 * (binEdges[i] + binEdges[i + 1]);
        }
    }

    /**
     * 最小エネルギー（keV）を返します。
     *
     * @return 最小エネルギーです
     */
    public double emin() {
        return emin;
    }

    /**
     * 最大エネルギー（keV）を返します。
     *
     * @return 最大エネルギーです
     */
    public double emax() {
        return emax;
    }

    /**
     * チャネル数を返します。
     *
     * @return チャネル数です
     */
    public int nchan() {
        return nchan;
    }

    /**
     * ビン端の配列（コピー）を返します。
     *
     * @return 長さ nchan+1 のビン端です
     */
    public double[] binEdges() {
        return binEdges.clone();
    }

    /**
     * ビン幅の配列（コピー）を返します。
     *
     * @return 長さ nchan のビン幅です
     */
    public double[] binWidths() {
        return binWidths.clone();
    }

    /**
     * ビン中心の配列（コピー）を返します。
     *
     * @return 長さ nchan のビン中心です
     */
    public double[] binCenters() {
        return binCenters.clone();
    }

    /**
     * エネルギーが属するチャネルを返します。
     *
     * <p>
     * {@code energy} 以下となる最も右のビン端のインデックスです。 グリッドより下なら -1、{@code emax} 以上なら nchan を返します。
     * </p>
     *
     * @param energy エネルギー（keV）です
     * @return チャネルインデックスです
     */
    public int channelOf(double energy) {
        int lo = 0;
        int hi = binEdges.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (binEdges[mid] <= energy) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "EnergyGrid[emin=%s keV, emax=%s keV, nchan=%d]", emin,
                emax, nchan);
    }
}
