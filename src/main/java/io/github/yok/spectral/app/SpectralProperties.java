package io.github.yok.spectral.app;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * spectral-models の設定値（spectral.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時のモデル構築に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "spectral")
public class SpectralProperties {

    /**
     * エネルギーグリッド設定です。
     */
    @Valid
    private EnergyGrid energyGrid = new EnergyGrid();

    /**
     * 観測赤方偏移 z です。
     */
    private double redshift = 0.0;

    /**
     * スペクトルを計算する温度 kT（keV）の一覧です。
     */
    @NotEmpty
    private List<Double> temperatures = List.of();

    /**
     * 放射モデル設定です。
     */
    @Valid
    private Emission emission = new Emission();

    /**
     * 吸収モデル設定です。
     */
    @Valid
    private Absorption absorption = new Absorption();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "spectral")
    public String toMultilineString() {
        String nl = System.lineSeparator();
        EnergyGrid g = getEnergyGrid();
        Emission e = getEmission();
        Absorption a = getAbsorption();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "energyGrid",
                "emin", g.getEmin(),
                "emax", g.getEmax(),
                "nchan", g.getNchan());

        appendSection(sb, nl, "run",
                "redshift", getRedshift(),
                "temperatures", getTemperatures());

        appendSection(sb, nl, "emission",
                "backend", e.getBackend(),
                // TABLE 用
                "tableRoot", e.getTableRoot(),
                "tableVersion", e.getTableVersion(),
                // EXTERNAL 用
                "modelName", e.getModelName(),
                "thermalBroadening", e.isThermalBroadening(),
                "settings", e.getSettings());

        appendSection(sb, nl, "absorption",
                "enabled", a.isEnabled(),
                "backend", a.getBackend(),
                "tableFile", a.getTableFile(),
                "modelName", a.getModelName(),
                "columnDensity", a.getColumnDensity(),
                "settings", a.getSettings());

        appendSection(sb, nl, "output",
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * モデルの実装種別です。
     */
    public enum Backend {
        /**
         * テーブル（ファイル）から計算します。
         */
        TABLE,

        /**
         * 外部フィッティングツールで計算します。
         */
        EXTERNAL
    }

    @Data
    public static class EnergyGrid {

        /**
         * 最小エネルギー（keV）です。
         */
        private double emin = 0.05;

        /**
         * 最大エネルギー（keV）です。
         */
        private double emax = 50.0;

        /**
         * チャネル数です。
         */
        @Positive
        private int nchan = 1000;
    }

    @Data
    public static class Emission {

        /**
         * 実装種別です。
         */
        @NotNull
        private Backend backend = Backend.TABLE;

        /**
         * APEC テーブルのディレクトリです。
         */
        private String tableRoot = "./atomdb";

        /**
         * APEC テーブルのバージョンです。
         */
        private String tableVersion = "2.0.2";

        /**
         * 外部ツール上のモデル名です。
         */
        private String modelName = "apec";

        /**
         * 熱的広がりを適用するかどうかです。
         */
        private boolean thermalBroadening = false;

        /**
         * 外部ツールに渡す追加のモデル文字列です。
         */
        private Map<String, String> settings = new LinkedHashMap<>();
    }

    @Data
    public static class Absorption {

        /**
         * 吸収モデルを使うかどうかです。
         */
        private boolean enabled = false;

        /**
         * 実装種別です。
         */
        @NotNull
        private Backend backend = Backend.TABLE;

        /**
         * 断面積テーブル（HDF5）のパスです。
         */
        private String tableFile = "./abs_table.h5";

        /**
         * 外部ツール上の吸収モデル名です。
         */
        private String modelName = "wabs";

        /**
         * 柱密度（10^22 cm^-2 単位）です。
         */
        @PositiveOrZero
        private double columnDensity = 0.1;

        /**
         * 外部ツールに渡す追加のモデル文字列です。
         */
        private Map<String, String> settings = new LinkedHashMap<>();
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
