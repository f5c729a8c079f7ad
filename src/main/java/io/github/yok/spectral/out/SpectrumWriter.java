package io.github.yok.spectral.out;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.spectrum.Spectrum;

/**
 * 計算したスペクトルを出力する処理のインタフェースです。
 */
public interface SpectrumWriter {

    /**
     * 温度 kT の放射率スペクトルを出力します。
     *
     * @param grid エネルギーグリッドです
     * @param kT 温度（keV）です
     * @param spectrum 放射率スペクトルの組です
     */
    void writeEmission(EnergyGrid grid, double kT, EmissionSpectrum spectrum);

    /**
     * 透過率スペクトルを出力します。
     *
     * @param grid エネルギーグリッドです
     * @param transmission 透過率スペクトルです
     */
    void writeAbsorption(EnergyGrid grid, Spectrum transmission);
}
