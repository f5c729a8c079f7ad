package io.github.yok.spectral.core.synthesis;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.spectral.core.error.TableNotFoundException;
import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.model.AbsorptionModel;
import io.github.yok.spectral.core.model.PreparationState;
import io.github.yok.spectral.core.spectrum.Spectrum;
import io.github.yok.spectral.core.spectrum.SpectrumUnit;
import io.github.yok.spectral.core.table.CrossSectionTable;
import io.github.yok.spectral.core.table.CrossSectionTableReader;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * 断面積テーブルから Beer-Lambert 則 {@code exp(-sigma * N_H)} で透過率を求める吸収モデルです。
 *
 * <p>
 * エネルギーグリッドはテーブルから決まります（範囲は energy の最小・最大、チャネル数は cross_section の点数）。
 * </p>
 */
@Slf4j
public final class TabulatedAbsorptionModel implements AbsorptionModel {

    /**
     * 柱密度の入力単位（cm^-2）です。
     */
    public static final double COLUMN_DENSITY_UNIT = 1.0e22;

    /**
     * エネルギーグリッドです。
     */
    private final EnergyGrid grid;

    /**
     * チャネルごとの断面積（cm^2）です。
     */
    private final double[] crossSection;

    /**
     * 柱密度（cm^-2）です。
     */
    private final double columnDensity;

    private PreparationState state = PreparationState.UNPREPARED;

    /**
     * 吸収モデルを生成します。
     *
     * @param table 断面積テーブルです
     * @param nH 柱密度（10^22 cm^-2 単位、0 以上）です
     * @throws IllegalArgumentException nH が負または非有限の場合に発生します
     */
    public TabulatedAbsorptionModel(CrossSectionTable table, double nH) {
        checkNotNull(table, "table は null 不可です");
        checkArgument(nH >= 0.0 && Double.isFinite(nH), "nH は 0 以上の有限値が必要です: %s", nH);
        this.grid = new EnergyGrid(table.minEnergy(), table.maxEnergy(), table.channelCount());
        this.crossSection = table.crossSection();
        this.columnDensity = nH * COLUMN_DENSITY_UNIT;
    }

    /**
     * テーブルファイルを読み込んで吸収モデルを生成します。
     *
     * @param file 断面積テーブルのパスです
     * @param nH 柱密度（10^22 cm^-2 単位）です
     * @param reader 断面積テーブルのリーダです
     * @return 吸収モデルです
     * @throws TableNotFoundException ファイルが存在しない場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public static TabulatedAbsorptionModel fromFile(Path file, double nH,
            CrossSectionTableReader reader) {
        checkNotNull(reader, "reader は null 不可です");
        try {
            return new TabulatedAbsorptionModel(reader.read(file), nH);
        } catch (NoSuchFileException e) {
            log.error("断面積テーブルが存在しません: {}", file);
            throw new TableNotFoundException("Cross-section", file, e);
        } catch (IOException e) {
            throw new IllegalStateException("断面積テーブルを読み込めません: " + file, e);
        }
    }

    @Override
    public EnergyGrid energyGrid() {
        return grid;
    }

    @Override
    public void prepare() {
        state = PreparationState.PREPARED;
        log.info("テーブル吸収モデルを準備しました。{}、N_H={} cm^-2", grid, columnDensity);
    }

    @Override
    public Spectrum getSpectrum() {
        checkState(state == PreparationState.PREPARED, "prepare() が呼ばれていません");
        double[] t = new double[crossSection.length];
        for (int i = 0; i < t.length; i++) {
            t[i] = Math.exp(-crossSection[i] * columnDensity);
        }
        return new Spectrum(t, SpectrumUnit.TRANSMISSION);
    }

    @Override
    public PreparationState state() {
        return state;
    }

    /**
     * 柱密度（cm^-2）を返します。
     *
     * @return 柱密度です
     */
    public double columnDensity() {
        return columnDensity;
    }
}
