package io.github.yok.spectral.app;

import io.github.yok.spectral.core.model.AbsorptionModel;
import io.github.yok.spectral.core.model.EmissionModel;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.spectrum.Spectrum;
import io.github.yok.spectral.out.SpectrumWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で spectral-models を実行するクラスです。
 *
 * <p>
 * 放射モデルを準備し、設定された温度ごとにスペクトルを計算して出力します。 吸収モデルが有効な場合は透過率も 1 回出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpectralCliRunner implements CommandLineRunner {

    /**
     * spectral-models の設定値（spectral.*）です。
     */
    private final SpectralProperties properties;

    /**
     * 放射モデルです。
     */
    private final EmissionModel emissionModel;

    /**
     * 吸収モデルです（無効な場合は存在しません）。
     */
    private final ObjectProvider<AbsorptionModel> absorptionModel;

    /**
     * 結果出力ロジックです。
     */
    private final SpectrumWriter spectrumWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        log.info("=== spectral-models start ==={}", properties.toMultilineString());

        List<Double> temperatures = properties.getTemperatures();
        if (temperatures == null || temperatures.isEmpty()) {
            throw new IllegalStateException("temperatures は必須です（kT の一覧を指定してください）");
        }

        double z = properties.getRedshift();
        emissionModel.prepare(z);

        for (int i = 0; i < temperatures.size(); i++) {
            Double kTObj = temperatures.get(i);
            if (kTObj == null) {
                throw new IllegalStateException("temperatures に null が含まれています");
            }
            double kT = kTObj.doubleValue();

            EmissionSpectrum spec = emissionModel.getSpectrum(kT);
            spectrumWriter.writeEmission(emissionModel.energyGrid(), kT, spec);

            log.info("放射スペクトル: kT={} keV（step={}/{}）、trace 合計={}、metal 合計={}", fmt5(kT), i + 1,
                    temperatures.size(), fmt5(spec.getTrace().sum()), fmt5(spec.getMetal().sum()));
            if (spec.getTrace().isZero() && spec.getMetal().isZero()) {
                log.warn("kT={} keV のスペクトルは全チャネル 0 です（テーブル範囲外の可能性があります）", fmt5(kT));
            }
        }

        AbsorptionModel absorption = absorptionModel.getIfAvailable();
        if (absorption != null) {
            absorption.prepare(z);
            Spectrum transmission = absorption.getSpectrum();
            spectrumWriter.writeAbsorption(absorption.energyGrid(), transmission);
            log.info("透過率スペクトルを出力しました。{}", absorption.energyGrid());
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
