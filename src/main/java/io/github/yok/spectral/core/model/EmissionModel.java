package io.github.yok.spectral.core.model;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;

/**
 * 温度に依存する放射率スペクトルを返すモデルのインタフェースです。
 *
 * <p>
 * 外部ツール版とテーブル版を差し替えるための境界です。 1 つのインスタンスを複数スレッドから同時に問い合わせないでください。
 * </p>
 */
public interface EmissionModel {

    /**
     * このモデルのエネルギーグリッドを返します。
     *
     * @return エネルギーグリッドです
     */
    EnergyGrid energyGrid();

    /**
     * 観測赤方偏移を与えてモデルを準備します。
     *
     * @param redshift 赤方偏移 z です
     */
    void prepare(double redshift);

    /**
     * 温度 kT（keV）における放射率スペクトルを返します。
     *
     * @param kT 温度（keV）です
     * @return 微量元素成分と金属成分の組です（単位 cm^3/s）
     * @throws IllegalStateException 未準備の場合に発生します
     */
    EmissionSpectrum getSpectrum(double kT);

    /**
     * 現在の準備状態を返します。
     *
     * @return 準備状態です
     */
    PreparationState state();
}
