package io.github.yok.spectral.core.table;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * ライン表・連続成分表が存在するプラズマ温度（keV）の単調増加列です。
 *
 * <p>
 * 温度 {@code T[i]} のデータはブロック {@code i + }{@link #BLOCK_OFFSET} に格納されています。
 * </p>
 */
public final class TemperatureGrid {

    /**
     * 温度インデックスからテーブルブロックインデックスへのオフセットです（プライマリと温度グリッドのブロックを飛ばします）。
     */
    public static final int BLOCK_OFFSET = 2;

    /**
     * 温度の値です。
     */
    private final double[] temperatures;

    /**
     * 隣接温度の差 {@code dT[i] = T[i+1] - T[i]} です。
     */
    private final double[] steps;

    /**
     * 温度グリッドを生成します。
     *
     * @param temperatures 温度（keV）の正の狭義単調増加列です（null 不可）
     * @throws IllegalArgumentException 空、0 以下・非有限値を含む、または単調増加でない場合に発生します
     */
    public TemperatureGrid(double[] temperatures) {
        checkNotNull(temperatures, "temperatures は null 不可です");
        checkArgument(temperatures.length > 0, "温度グリッドが空です");
        // 熱的広がりの幅 sqrt(kT) は正でなければならない
        checkArgument(temperatures[0] > 0.0 && Double.isFinite(temperatures[0]),
                "温度グリッドは正の有限値である必要があります: T[0]=%s", temperatures[0]);
        checkArgument(Double.isFinite(temperatures[temperatures.length - 1]),
                "温度グリッドは正の有限値である必要があります: T[n-1]=%s",
                temperatures[temperatures.length - 1]);
        for (int i = 1; i < temperatures.length; i++) {
            checkArgument(temperatures[i] > temperatures[i - 1],
                    "温度グリッドは狭義単調増加である必要があります: T[%s]=%s, T[%s]=%s", i - 1,
                    temperatures[i - 1], i, temperatures[i]);
        }
        this.temperatures = temperatures.clone();
        this.steps = new double[temperatures.length - 1];
        for (int i = 0; i < steps.length; i++) {
            steps[i] = temperatures[i + 1] - temperatures[i];
        }
    }

    /**
     * 温度の個数を返します。
     *
     * @return 個数です
     */
    public int size() {
        return temperatures.length;
    }

    /**
     * i 番目の温度を返します。
     *
     * @param i インデックスです
     * @return 温度（keV）です
     */
    public double get(int i) {
        return temperatures[i];
    }

    /**
     * i 番目の温度差 {@code T[i+1] - T[i]} を返します。
     *
     * @param i インデックスです
     * @return 温度差です
     */
    public double step(int i) {
        return steps[i];
    }

    /**
     * kT 以下となる最大の格子温度のインデックスを返します。
     *
     * <p>
     * 全温度が kT より大きい場合は -1 です。
     * </p>
     *
     * @param kT 温度（keV）です
     * @return インデックスです
     */
    public int floorIndex(double kT) {
        int lo = 0;
        int hi = temperatures.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (temperatures[mid] <= kT) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo - 1;
    }

    /**
     * 補間に使える区間 {@code [T[i], T[i+1])} のインデックスかを返します。
     *
     * @param tindex {@link #floorIndex(double)} の結果です
     * @return 補間できる場合は true です
     */
    public boolean isInterpolable(int tindex) {
        return tindex >= 0 && tindex <= temperatures.length - 2;
    }

    /**
     * 区間内の補間係数 {@code (kT - T[i]) / dT[i]} を返します。
     *
     * @param tindex 区間インデックスです
     * @param kT 温度（keV）です
     * @return 補間係数です
     */
    public double fraction(int tindex, double kT) {
        return (kT - temperatures[tindex]) / steps[tindex];
    }

    /**
     * 温度インデックスに対応するテーブルブロックインデックスを返します。
     *
     * @param tindex 温度インデックスです
     * @return ブロックインデックスです
     */
    public static int blockOf(int tindex) {
        return tindex + BLOCK_OFFSET;
    }

    /**
     * 最小温度を返します。
     *
     * @return 最小温度（keV）です
     */
    public double min() {
        return temperatures[0];
    }

    /**
     * 最大温度を返します。
     *
     * @return 最大温度（keV）です
     */
    public double max() {
        return temperatures[temperatures.length - 1];
    }
}
