package io.github.yok.spectral.core.synthesis;

/**
 * スペクトル合成で使う物理定数（CGS と keV・Å 系）です。
 */
public final class PhysicalConstants {

    /**
     * プランク定数と光速の積 hc（keV・Å）です。
     */
    public static final double HC_KEV_ANGSTROM = 12.398419843320026;

    /**
     * 光速（cm/s）です。
     */
    public static final double SPEED_OF_LIGHT_CGS = 2.99792458e10;

    /**
     * 1 keV あたりの erg です。
     */
    public static final double ERG_PER_KEV = 1.602176634e-9;

    /**
     * 原子質量単位（g）です。
     */
    public static final double AMU_CGS = 1.66053906660e-24;

    private PhysicalConstants() {}
}
