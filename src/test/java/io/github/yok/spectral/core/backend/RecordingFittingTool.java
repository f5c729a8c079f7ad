package io.github.yok.spectral.core.backend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 呼び出しを記録するテスト用の外部フィッティングツールです。
 *
 * <p>
 * モデルの評価値は {@link #evaluator} にパラメータ表を渡して決めます。 ServiceLoader からも見つかるよう
 * META-INF/services に登録しています。
 * </p>
 */
public final class RecordingFittingTool implements FittingTool {

    final List<String> calls = new ArrayList<>();

    final Map<String, String> modelStrings = new LinkedHashMap<>();

    final Map<String, Double> parameters = new HashMap<>();

    int nchan;

    Function<Map<String, Double>, Double> evaluator = p -> 1.0;

    @Override
    public String name() {
        return "recording";
    }

    @Override
    public FittingToolSession openSession() {
        calls.add("openSession");
        return new Session();
    }

    private final class Session implements FittingToolSession {

        @Override
        public void setChatter(int level) {
            calls.add("chatter=" + level);
        }

        @Override
        public void setEnergies(double emin, double emax, int n, String binning) {
            calls.add("energies=" + emin + "," + emax + "," + n + " " + binning);
            nchan = n;
        }

        @Override
        public void addModelString(String key, String value) {
            modelStrings.put(key, value);
        }

        @Override
        public FittingToolModel createModel(String expression) {
            calls.add("model=" + expression);
            return new Model();
        }
    }

    private final class Model implements FittingToolModel {

        @Override
        public void setParameter(String component, String parameter, double value) {
            parameters.put(component + "." + parameter, value);
        }

        @Override
        public double[] values(int spectrumIndex) {
            double[] out = new double[nchan];
            Arrays.fill(out, evaluator.apply(parameters));
            return out;
        }
    }
}
