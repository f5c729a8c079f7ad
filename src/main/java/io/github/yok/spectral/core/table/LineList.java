package io.github.yok.spectral.core.table;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 1 つの温度ブロックに含まれる輝線のリストです。
 *
 * <p>
 * 各行は（元素の原子番号、静止系波長（Å）、放射振幅）の組です。
 * </p>
 */
public final class LineList {

    private final int[] elements;

    private final double[] wavelengths;

    private final double[] amplitudes;

    /**
     * 輝線リストを生成します。
     *
     * @param elements 原子番号です
     * @param wavelengths 静止系波長（Å）です
     * @param amplitudes 放射振幅です
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    public LineList(int[] elements, double[] wavelengths, double[] amplitudes) {
        checkNotNull(elements, "elements は null 不可です");
        checkNotNull(wavelengths, "wavelengths は null 不可です");
        checkNotNull(amplitudes, "amplitudes は null 不可です");
        checkArgument(elements.length == wavelengths.length && elements.length == amplitudes.length,
                "列の長さが一致しません: element=%s, lambda=%s, epsilon=%s", elements.length,
                wavelengths.length, amplitudes.length);
        this.elements = elements.clone();
        this.wavelengths = wavelengths.clone();
        this.amplitudes = amplitudes.clone();
    }

    /**
     * ライン表のブロックから輝線リストを読み込みます。
     *
     * @param block ブロックです（列 element, lambda, epsilon）
     * @return 輝線リストです
     */
    public static LineList from(ColumnarBlock block) {
        return new LineList(block.intColumn("element"), block.doubleColumn("lambda"),
                block.doubleColumn("epsilon"));
    }

    /**
     * 指定元素で、波長が開区間 {@code (minWavelength, maxWavelength)} にある輝線を選びます。
     *
     * @param element 原子番号です
     * @param minWavelength 波長下限（Å、含まない）です
     * @param maxWavelength 波長上限（Å、含まない）です
     * @return 選ばれた輝線のリストです
     */
    public LineList select(int element, double minWavelength, double maxWavelength) {
        int count = 0;
        for (int i = 0; i < elements.length; i++) {
            if (matches(i, element, minWavelength, maxWavelength)) {
                count++;
            }
        }
        int[] e = new int[count];
        double[] w = new double[count];
        double[] a = new double[count];
        int k = 0;
        for (int i = 0; i < elements.length; i++) {
            if (matches(i, element, minWavelength, maxWavelength)) {
                e[k] = elements[i];
                w[k] = wavelengths[i];
                a[k] = amplitudes[i];
                k++;
            }
        }
        return new LineList(e, w, a);
    }

    private boolean matches(int i, int element, double minWavelength, double maxWavelength) {
        return elements[i] == element && wavelengths[i] > minWavelength
                && wavelengths[i] < maxWavelength;
    }

    /**
     * 輝線の本数を返します。
     *
     * @return 本数です
     */
    public int size() {
        return elements.length;
    }

    /**
     * i 番目の輝線の原子番号を返します。
     *
     * @param i インデックスです
     * @return 原子番号です
     */
    public int element(int i) {
        return elements[i];
    }

    /**
     * i 番目の輝線の静止系波長（Å）を返します。
     *
     * @param i インデックスです
     * @return 波長です
     */
    public double wavelength(int i) {
        return wavelengths[i];
    }

    /**
     * i 番目の輝線の放射振幅を返します。
     *
     * @param i インデックスです
     * @return 振幅です
     */
    public double amplitude(int i) {
        return amplitudes[i];
    }
}
