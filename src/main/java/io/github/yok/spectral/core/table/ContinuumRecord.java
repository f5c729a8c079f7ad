package io.github.yok.spectral.core.table;

import java.util.Arrays;
import lombok.Getter;

/**
 * 1 元素分の連続成分と擬連続成分のサンプル曲線です。
 *
 * <p>
 * エネルギー（keV）と振幅の組を、有効点数（{@code N_Cont}, {@code N_Pseudo}）で切り詰めて保持します。
 * </p>
 */
@Getter
public final class ContinuumRecord {

    /**
     * 原子番号（列 Z）です。
     */
    private final int element;

    /**
     * 連続成分のエネルギー（keV）です。
     */
    private final double[] continuumEnergies;

    /**
     * 連続成分の振幅です。
     */
    private final double[] continuum;

    /**
     * 擬連続成分のエネルギー（keV）です。
     */
    private final double[] pseudoEnergies;

    /**
     * 擬連続成分の振幅です。
     */
    private final double[] pseudo;

    /**
     * 連続成分レコードを生成します。
     *
     * @param element 原子番号です
     * @param continuumEnergies 連続成分のエネルギーです
     * @param continuum 連続成分の振幅です
     * @param pseudoEnergies 擬連続成分のエネルギーです
     * @param pseudo 擬連続成分の振幅です
     * @throws IllegalArgumentException エネルギーと振幅の長さが一致しない場合に発生します
     */
    public ContinuumRecord(int element, double[] continuumEnergies, double[] continuum,
            double[] pseudoEnergies, double[] pseudo) {
        if (continuumEnergies.length != continuum.length) {
            throw new IllegalArgumentException("連続成分の長さが一致しません: Z=" + element + ", E="
                    + continuumEnergies.length + ", value=" + continuum.length);
        }
        if (pseudoEnergies.length != pseudo.length) {
            throw new IllegalArgumentException("擬連続成分の長さが一致しません: Z=" + element + ", E="
                    + pseudoEnergies.length + ", value=" + pseudo.length);
        }
        this.element = element;
        this.continuumEnergies = continuumEnergies.clone();
        this.continuum = continuum.clone();
        this.pseudoEnergies = pseudoEnergies.clone();
        this.pseudo = pseudo.clone();
    }

    /**
     * 有効点数で切り詰めた配列を返します。
     *
     * @param values 元の配列です
     * @param n 有効点数です
     * @return 先頭 n 点です
     */
    static double[] head(double[] values, int n) {
        if (n < 0 || n > values.length) {
            throw new IllegalArgumentException("有効点数が配列長の範囲外です: n=" + n + ", length="
                    + values.length);
        }
        return Arrays.copyOf(values, n);
    }
}
