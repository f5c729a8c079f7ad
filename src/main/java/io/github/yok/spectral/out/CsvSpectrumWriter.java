package io.github.yok.spectral.out;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.spectrum.Spectrum;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * スペクトルを CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（kT は温度 keV）。
 * </p>
 *
 * <ul>
 * <li>{@code spectral_emission_kT=1.0000.csv}（channel, eLow, eHigh, eMid, trace, metal, total）</li>
 * <li>{@code spectral_absorption.csv}（channel, eLow, eHigh, eMid, transmission）</li>
 * </ul>
 */
public final class CsvSpectrumWriter implements SpectrumWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "spectral";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvSpectrumWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 放射率スペクトルを出力します。
     *
     * @param grid エネルギーグリッドです
     * @param kT 温度（keV）です
     * @param spectrum 放射率スペクトルの組です
     * @throws IllegalArgumentException チャネル数が一致しない場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeEmission(EnergyGrid grid, double kT, EmissionSpectrum spectrum) {
        if (grid == null || spectrum == null) {
            throw new IllegalArgumentException("grid/spectrum は null 不可です");
        }
        requireLength(grid, spectrum.getTrace());
        requireLength(grid, spectrum.getMetal());

        Path file = outputDir.resolve(FILE_HEAD + "_emission_kT=" + formatKt(kT) + ".csv");
        double[] trace = spectrum.getTrace().values();
        double[] metal = spectrum.getMetal().values();

        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("channel", "eLow", "eHigh", "eMid", "trace", "metal",
                                    "total")
                            .build().print(w)) {
                double[] edges = grid.binEdges();
                double[] centers = grid.binCenters();
                for (int i = 0; i < grid.nchan(); i++) {
                    pr.printRecord(i, edges[i], edges[i + 1], centers[i], trace[i], metal[i],
                            trace[i] + metal[i]);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * 透過率スペクトルを出力します。
     *
     * @param grid エネルギーグリッドです
     * @param transmission 透過率スペクトルです
     * @throws IllegalArgumentException チャネル数が一致しない場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeAbsorption(EnergyGrid grid, Spectrum transmission) {
        if (grid == null || transmission == null) {
            throw new IllegalArgumentException("grid/transmission は null 不可です");
        }
        requireLength(grid, transmission);

        Path file = outputDir.resolve(FILE_HEAD + "_absorption.csv");
        double[] t = transmission.values();

        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("channel", "eLow", "eHigh", "eMid", "transmission")
                            .build().print(w)) {
                double[] edges = grid.binEdges();
                double[] centers = grid.binCenters();
                for (int i = 0; i < grid.nchan(); i++) {
                    pr.printRecord(i, edges[i], edges[i + 1], centers[i], t[i]);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    private static void requireLength(EnergyGrid grid, Spectrum spectrum) {
        if (spectrum.length() != grid.nchan()) {
            throw new IllegalArgumentException("スペクトル長とチャネル数が一致しません: length="
                    + spectrum.length() + ", nchan=" + grid.nchan());
        }
    }

    /**
     * 温度を小数点以下4桁に整形します（ファイル名用）。
     *
     * @param kT 温度です
     * @return 整形文字列（例: 1.0000）
     */
    private static String formatKt(double kT) {
        return String.format(Locale.ROOT, "%.4f", kT);
    }
}
