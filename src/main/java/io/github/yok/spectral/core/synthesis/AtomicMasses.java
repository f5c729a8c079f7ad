package io.github.yok.spectral.core.synthesis;

/**
 * 原子番号 1〜30 の標準原子量（amu）です。
 */
public final class AtomicMasses {

    /**
     * 原子番号をインデックスとした原子量です（インデックス 0 は未使用）。
     */
    private static final double[] MASSES = {0.0, 1.00794, 4.00262, 6.941, 9.012182, 10.811,
            12.0107, 14.0067, 15.9994, 18.9984, 20.1797, 22.9898, 24.3050, 26.9815, 28.0855,
            30.9738, 32.0650, 35.4530, 39.9480, 39.0983, 40.0780, 44.9559, 47.8670, 50.9415,
            51.9961, 54.9380, 55.8450, 58.9332, 58.6934, 63.5460, 65.3800};

    private AtomicMasses() {}

    /**
     * 原子量を返します。
     *
     * @param element 原子番号です（1〜30）
     * @return 原子量（amu）です
     * @throws IllegalArgumentException 範囲外の原子番号の場合に発生します
     */
    public static double of(int element) {
        if (element < 1 || element >= MASSES.length) {
            throw new IllegalArgumentException("原子量が定義されていない原子番号です: " + element);
        }
        return MASSES[element];
    }
}
