package io.github.yok.spectral.core.synthesis;

/**
 * 区分線形補間です。
 *
 * <p>
 * サンプル範囲外の点は端の値で一定とします。
 * </p>
 */
final class LinearInterpolation {

    private LinearInterpolation() {}

    /**
     * サンプル {@code (xp, fp)} を点 {@code x} に線形補間します。
     *
     * @param x 評価点です
     * @param xp サンプル点（昇順）です
     * @param fp サンプル値です
     * @return 評価点ごとの補間値です（サンプルが空の場合は全て 0）
     */
    static double[] interpolate(double[] x, double[] xp, double[] fp) {
        double[] out = new double[x.length];
        int n = xp.length;
        if (n == 0) {
            return out;
        }
        for (int i = 0; i < x.length; i++) {
            double xi = x[i];
            if (xi <= xp[0]) {
                out[i] = fp[0];
                continue;
            }
            if (xi >= xp[n - 1]) {
                out[i] = fp[n - 1];
                continue;
            }
            int j = upperIndex(xp, xi);
            double x0 = xp[j - 1];
            double x1 = xp[j];
            double t = (x1 == x0) ? 0.0 : (xi - x0) / (x1 - x0);
            out[i] = fp[j - 1] + t * (fp[j] - fp[j - 1]);
        }
        return out;
    }

    /**
     * {@code xp[j-1] <= x < xp[j]} となる j を返します。
     */
    private static int upperIndex(double[] xp, double x) {
        int lo = 0;
        int hi = xp.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (xp[mid] <= x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
