package io.github.yok.spectral.core.spectrum;

import lombok.Value;

/**
 * 放射モデルが返す 2 成分（微量元素/宇宙組成成分と金属成分）の組です。
 *
 * <p>
 * 下流で金属量を独立にスケールできるよう、成分を分けたまま保持します。
 * </p>
 */
@Value
public class EmissionSpectrum {

    /**
     * H, He と微量元素の成分です。
     */
    Spectrum trace;

    /**
     * 金属成分です。
     */
    Spectrum metal;

    /**
     * 全チャネルが 0 の組を生成します。
     *
     * @param nchan チャネル数です
     * @return ゼロスペクトルの組です
     */
    public static EmissionSpectrum zeros(int nchan) {
        return new EmissionSpectrum(Spectrum.zeros(nchan, SpectrumUnit.EMISSIVITY),
                Spectrum.zeros(nchan, SpectrumUnit.EMISSIVITY));
    }

    /**
     * 2 成分の和（金属量 1 のスペクトル）を返します。
     *
     * @return 和のスペクトルです
     */
    public Spectrum total() {
        return trace.plus(metal);
    }
}
