package io.github.yok.spectral.core.spectrum;

/**
 * スペクトル値の物理単位です。
 */
public enum SpectrumUnit {

    /**
     * 放射率（体積・レート、cm^3/s）です。
     */
    EMISSIVITY("cm**3/s"),

    /**
     * 透過率（無次元）です。
     */
    TRANSMISSION("dimensionless");

    /**
     * 単位表記です。
     */
    private final String symbol;

    SpectrumUnit(String symbol) {
        this.symbol = symbol;
    }

    /**
     * 単位表記を返します。
     *
     * @return 単位表記です
     */
    public String symbol() {
        return symbol;
    }
}
