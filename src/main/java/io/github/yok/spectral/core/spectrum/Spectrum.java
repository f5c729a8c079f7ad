package io.github.yok.spectral.core.spectrum;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * エネルギーグリッドのチャネルごとの値と、その単位を保持するクラスです。
 *
 * <p>
 * 値配列は生成時と取得時にコピーし、外部から変更できないようにします。
 * </p>
 */
public final class Spectrum {

    /**
     * チャネルごとの値です。
     */
    private final double[] values;

    /**
     * 値の単位です。
     */
    private final SpectrumUnit unit;

    /**
     * スペクトルを生成します。
     *
     * @param values チャネルごとの値です（null 不可、コピーして保持します）
     * @param unit 単位です（null 不可）
     */
    public Spectrum(double[] values, SpectrumUnit unit) {
        this.values = checkNotNull(values, "values は null 不可です").clone();
        this.unit = checkNotNull(unit, "unit は null 不可です");
    }

    /**
     * 全チャネルが 0 のスペクトルを生成します。
     *
     * @param nchan チャネル数です
     * @param unit 単位です
     * @return ゼロスペクトルです
     */
    public static Spectrum zeros(int nchan, SpectrumUnit unit) {
        return new Spectrum(new double[nchan], unit);
    }

    /**
     * チャネル数を返します。
     *
     * @return チャネル数です
     */
    public int length() {
        return values.length;
    }

    /**
     * 指定チャネルの値を返します。
     *
     * @param channel チャネルです
     * @return 値です
     */
    public double get(int channel) {
        checkElementIndex(channel, values.length, "channel");
        return values[channel];
    }

    /**
     * 値配列（コピー）を返します。
     *
     * @return 値配列です
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * 単位を返します。
     *
     * @return 単位です
     */
    public SpectrumUnit unit() {
        return unit;
    }

    /**
     * 全チャネルの総和を返します。
     *
     * @return 総和です
     */
    public double sum() {
        double s = 0.0;
        for (double v : values) {
            s += v;
        }
        return s;
    }

    /**
     * 全チャネルが 0 かどうかを返します。
     *
     * @return 全て 0 の場合は true です
     */
    public boolean isZero() {
        for (double v : values) {
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 同じ単位・同じ長さのスペクトルをチャネルごとに加算します。
     *
     * @param other 加算するスペクトルです
     * @return 和のスペクトルです
     * @throws IllegalArgumentException 単位または長さが異なる場合に発生します
     */
    public Spectrum plus(Spectrum other) {
        checkNotNull(other, "other は null 不可です");
        if (other.unit != unit || other.values.length != values.length) {
            throw new IllegalArgumentException(
                    "単位または長さが一致しません: " + unit + "/" + values.length + " と " + other.unit + "/"
                            + other.values.length);
        }
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] + other.values[i];
        }
        return new Spectrum(out, unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spectrum)) {
            return false;
        }
        Spectrum other = (Spectrum) o;
        return unit == other.unit && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * unit.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Spectrum[nchan=" + values.length + ", unit=" + unit.symbol() + "]";
    }
}
