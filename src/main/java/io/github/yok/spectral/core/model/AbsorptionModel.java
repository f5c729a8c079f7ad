package io.github.yok.spectral.core.model;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.Spectrum;

/**
 * 柱密度に依存する透過率スペクトルを返すモデルのインタフェースです。
 *
 * <p>
 * 柱密度は構築時に固定します。
 * </p>
 */
public interface AbsorptionModel {

    /**
     * このモデルのエネルギーグリッドを返します。
     *
     * @return エネルギーグリッドです
     */
    EnergyGrid energyGrid();

    /**
     * モデルを準備します。
     */
    void prepare();

    /**
     * 赤方偏移を与えてモデルを準備します。
     *
     * <p>
     * 吸収は観測者側の前景で起こるため、既定では赤方偏移を使いません。
     * </p>
     *
     * @param redshift 赤方偏移 z です
     */
    default void prepare(double redshift) {
        prepare();
    }

    /**
     * 透過率スペクトル（各チャネル [0, 1]）を返します。
     *
     * @return 透過率スペクトルです
     * @throws IllegalStateException 未準備の場合に発生します
     */
    Spectrum getSpectrum();

    /**
     * 現在の準備状態を返します。
     *
     * @return 準備状態です
     */
    PreparationState state();
}
