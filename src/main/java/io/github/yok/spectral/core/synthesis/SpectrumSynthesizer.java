package io.github.yok.spectral.core.synthesis;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.spectrum.Spectrum;
import io.github.yok.spectral.core.spectrum.SpectrumUnit;
import io.github.yok.spectral.core.table.ContinuumRecord;
import io.github.yok.spectral.core.table.LineList;
import io.github.yok.spectral.core.table.TableCache;
import io.github.yok.spectral.core.table.TemperatureGrid;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * ライン表・連続成分表から、元素ごとの輝線＋連続成分＋擬連続成分を組み立てて放射率スペクトルを合成するクラスです。
 *
 * <p>
 * 温度方向は、問い合わせ温度を挟む 2 つのテーブルブロックの線形補間です。 各ブロックの寄与は元素ごとに
 * </p>
 * <ol>
 * <li>波長範囲内の輝線を観測系エネルギーに変換してビンに積み（熱的広がりがある場合はガウス分布の各ビンへの割合で配分）、</li>
 * <li>連続成分と擬連続成分をビン中心に線形補間してビン幅を掛けて足し込みます。</li>
 * </ol>
 */
@Slf4j
public final class SpectrumSynthesizer {

    /**
     * エネルギーグリッドです。
     */
    private final EnergyGrid grid;

    /**
     * オープン済みのテーブルキャッシュです。
     */
    private final TableCache tables;

    /**
     * 熱的（ドップラー）広がりを適用するかどうかです。
     */
    @Getter
    private final boolean thermalBroadening;

    /**
     * 輝線を選ぶ波長の下限（Å）です。
     */
    @Getter
    private final double minWavelength;

    /**
     * 輝線を選ぶ波長の上限（Å）です。
     */
    @Getter
    private final double maxWavelength;

    /**
     * 宇宙論的なエネルギー縮小率 {@code 1/(1+z)} です。
     */
    @Getter
    private final double scaleFactor;

    /**
     * 合成器を生成します。
     *
     * @param grid エネルギーグリッドです（emin &gt; 0）
     * @param tables オープン済みのテーブルキャッシュです
     * @param thermalBroadening 熱的広がりを適用するかどうかです
     * @param redshift 赤方偏移 z です（z &gt; -1）
     * @throws IllegalStateException テーブルが開かれていない場合に発生します
     */
    public SpectrumSynthesizer(EnergyGrid grid, TableCache tables, boolean thermalBroadening,
            double redshift) {
        this.grid = checkNotNull(grid, "grid は null 不可です");
        this.tables = checkNotNull(tables, "tables は null 不可です");
        checkState(tables.isOpen(), "テーブルが開かれていません");
        checkArgument(redshift > -1.0 && Double.isFinite(redshift),
                "redshift は -1 より大きい有限値が必要です: %s", redshift);
        this.thermalBroadening = thermalBroadening;

        // 波長ビン（昇順）は降順のエネルギービン端を反転して作る
        double[] edges = grid.binEdges();
        double[] wavelengthBins = new double[edges.length];
        for (int i = 0; i < edges.length; i++) {
            wavelengthBins[i] = PhysicalConstants.HC_KEV_ANGSTROM / edges[edges.length - 1 - i];
        }
        this.minWavelength = wavelengthBins[0];
        this.maxWavelength = wavelengthBins[wavelengthBins.length - 1];
        this.scaleFactor = 1.0 / (1.0 + redshift);
    }

    /**
     * 温度 kT における微量元素成分と金属成分を合成します。
     *
     * <p>
     * kT がテーブルの温度範囲 {@code [T[0], T[n-1])} の外にある場合は、エラーにせずゼロスペクトルを返します。
     * </p>
     *
     * @param kT 温度（keV）です
     * @return 放射率スペクトルの組（cm^3/s）です
     */
    public EmissionSpectrum synthesize(double kT) {
        TemperatureGrid temps = tables.temperatureGrid();
        int nchan = grid.nchan();

        int tindex = temps.floorIndex(kT);
        if (!temps.isInterpolable(tindex)) {
            log.debug("kT={} はテーブル範囲 [{}, {}) の外のためゼロスペクトルを返します", fmt(kT), temps.min(),
                    temps.max());
            return EmissionSpectrum.zeros(nchan);
        }
        double dT = temps.fraction(tindex, kT);
        int left = TemperatureGrid.blockOf(tindex);
        int right = left + 1;

        DMatrixRMaj traceLeft = sumElements(ElementPartition.TRACE, left);
        DMatrixRMaj traceRight = sumElements(ElementPartition.TRACE, right);
        DMatrixRMaj metalLeft = sumElements(ElementPartition.METAL, left);
        DMatrixRMaj metalRight = sumElements(ElementPartition.METAL, right);

        DMatrixRMaj trace = new DMatrixRMaj(nchan, 1);
        DMatrixRMaj metal = new DMatrixRMaj(nchan, 1);
        CommonOps_DDRM.add(1.0 - dT, traceLeft, dT, traceRight, trace);
        CommonOps_DDRM.add(1.0 - dT, metalLeft, dT, metalRight, metal);

        log.debug("kT={} を合成しました（tindex={}、dT={}、ブロック={}/{}）", fmt(kT), tindex, fmt(dT), left,
                right);
        return new EmissionSpectrum(new Spectrum(trace.getData(), SpectrumUnit.EMISSIVITY),
                new Spectrum(metal.getData(), SpectrumUnit.EMISSIVITY));
    }

    /**
     * グループ内の全元素の寄与を 1 ブロック分合計します。
     */
    private DMatrixRMaj sumElements(ElementPartition group, int block) {
        int nchan = grid.nchan();
        DMatrixRMaj sum = new DMatrixRMaj(nchan, 1);
        for (int element : group.elements()) {
            CommonOps_DDRM.addEquals(sum,
                    DMatrixRMaj.wrap(nchan, 1, elementSpectrum(element, block)));
        }
        return sum;
    }

    /**
     * 1 元素・1 ブロック分の輝線＋連続成分＋擬連続成分を組み立てます。
     *
     * @param element 原子番号です
     * @param block テーブルブロックインデックスです
     * @return チャネルごとの寄与（テーブル単位）です
     */
    public double[] elementSpectrum(int element, int block) {
        double[] spec = lineSpectrum(element, block);

        Optional<ContinuumRecord> found = tables.continuumTable(block).find(element);
        if (found.isEmpty()) {
            return spec;
        }
        ContinuumRecord rec = found.get();
        double[] centers = grid.binCenters();
        double[] widths = grid.binWidths();

        double[] cont = LinearInterpolation.interpolate(centers,
                scaled(rec.getContinuumEnergies()), rec.getContinuum());
        double[] pseudo = LinearInterpolation.interpolate(centers,
                scaled(rec.getPseudoEnergies()), rec.getPseudo());
        for (int i = 0; i < spec.length; i++) {
            spec[i] += cont[i] * widths[i];
            spec[i] += pseudo[i] * widths[i];
        }
        return spec;
    }

    /**
     * 1 元素・1 ブロック分の輝線だけをビンに積みます。
     *
     * @param element 原子番号です
     * @param block テーブルブロックインデックスです
     * @return チャネルごとの輝線寄与です
     */
    double[] lineSpectrum(int element, int block) {
        double[] spec = new double[grid.nchan()];
        LineList lines = tables.lineList(block).select(element, minWavelength, maxWavelength);
        if (lines.size() == 0) {
            return spec;
        }

        if (thermalBroadening) {
            double[] edges = grid.binEdges();
            double kTBlock = tables.temperatureGrid().get(block - TemperatureGrid.BLOCK_OFFSET);
            double thermalSpeed = Math.sqrt(kTBlock * PhysicalConstants.ERG_PER_KEV
                    / (AtomicMasses.of(element) * PhysicalConstants.AMU_CGS));
            double[] cdf = new double[edges.length];
            for (int k = 0; k < lines.size(); k++) {
                double e0 = observedEnergy(lines.wavelength(k));
                double sigma = e0 * thermalSpeed / PhysicalConstants.SPEED_OF_LIGHT_CGS;
                NormalDistribution profile = new NormalDistribution(null, e0, sigma);
                for (int j = 0; j < edges.length; j++) {
                    cdf[j] = profile.cumulativeProbability(edges[j]);
                }
                double a = lines.amplitude(k);
                for (int i = 0; i < spec.length; i++) {
                    spec[i] += (cdf[i + 1] - cdf[i]) * a;
                }
            }
        } else {
            for (int k = 0; k < lines.size(); k++) {
                int channel = grid.channelOf(observedEnergy(lines.wavelength(k)));
                // 赤方偏移でグリッド外に出た輝線は捨てる
                if (channel < 0 || channel >= spec.length) {
                    continue;
                }
                spec[channel] += lines.amplitude(k);
            }
        }
        return spec;
    }

    private double observedEnergy(double wavelength) {
        return PhysicalConstants.HC_KEV_ANGSTROM / wavelength * scaleFactor;
    }

    private double[] scaled(double[] energies) {
        double[] out = new double[energies.length];
        for (int i = 0; i < energies.length; i++) {
            out[i] = energies[i] * scaleFactor;
        }
        return out;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
