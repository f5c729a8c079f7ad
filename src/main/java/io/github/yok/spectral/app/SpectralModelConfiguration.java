package io.github.yok.spectral.app;

import io.github.yok.spectral.core.backend.ExternalToolAbsorptionModel;
import io.github.yok.spectral.core.backend.ExternalToolEmissionModel;
import io.github.yok.spectral.core.backend.FittingToolSessionProvider;
import io.github.yok.spectral.core.backend.ServiceLoaderSessionProvider;
import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.model.AbsorptionModel;
import io.github.yok.spectral.core.model.EmissionModel;
import io.github.yok.spectral.core.synthesis.TabulatedAbsorptionModel;
import io.github.yok.spectral.core.synthesis.TabulatedEmissionModel;
import io.github.yok.spectral.core.table.ColumnarTableReader;
import io.github.yok.spectral.core.table.CrossSectionTableReader;
import io.github.yok.spectral.core.table.FitsColumnarTableReader;
import io.github.yok.spectral.core.table.Hdf5CrossSectionTableReader;
import io.github.yok.spectral.out.CsvSpectrumWriter;
import io.github.yok.spectral.out.SpectrumWriter;
import java.nio.file.Paths;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 放射モデル・吸収モデル・出力の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 実装種別（TABLE/EXTERNAL）は構築時に設定値から選びます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class SpectralModelConfiguration {

    /**
     * spectral-models の設定値（spectral.*）です。
     */
    private final SpectralProperties p;

    /**
     * エネルギーグリッドを生成します。
     *
     * @return エネルギーグリッドです
     */
    @Bean
    public EnergyGrid energyGrid() {
        SpectralProperties.EnergyGrid g = p.getEnergyGrid();
        return new EnergyGrid(g.getEmin(), g.getEmax(), g.getNchan());
    }

    /**
     * 列指向テーブル（FITS）のリーダを生成します。
     *
     * @return リーダです
     */
    @Bean
    public ColumnarTableReader columnarTableReader() {
        return new FitsColumnarTableReader();
    }

    /**
     * 断面積テーブル（HDF5）のリーダを生成します。
     *
     * @return リーダです
     */
    @Bean
    public CrossSectionTableReader crossSectionTableReader() {
        return new Hdf5CrossSectionTableReader();
    }

    /**
     * 外部フィッティングツールのセッションプロバイダを生成します。
     *
     * @return セッションプロバイダです
     */
    @Bean
    public FittingToolSessionProvider fittingToolSessionProvider() {
        return new ServiceLoaderSessionProvider();
    }

    /**
     * 放射モデルを生成します。
     *
     * @param grid エネルギーグリッドです
     * @param reader 列指向テーブルのリーダです
     * @param sessionProvider 外部ツールのセッションプロバイダです
     * @return 放射モデルです
     */
    @Bean
    public EmissionModel emissionModel(EnergyGrid grid, ColumnarTableReader reader,
            FittingToolSessionProvider sessionProvider) {
        SpectralProperties.Emission e = p.getEmission();
        switch (e.getBackend()) {
            case EXTERNAL:
                return new ExternalToolEmissionModel(e.getModelName(), grid,
                        e.isThermalBroadening(), e.getSettings(), sessionProvider);
            case TABLE:
            default:
                return new TabulatedEmissionModel(Paths.get(e.getTableRoot()),
                        e.getTableVersion(), grid, e.isThermalBroadening(), reader);
        }
    }

    /**
     * 吸収モデルを生成します（spectral.absorption.enabled=true の場合のみ）。
     *
     * <p>
     * テーブル版はこの時点で断面積テーブルを読み込み、グリッドをテーブルから決めます。
     * </p>
     *
     * @param reader 断面積テーブルのリーダです
     * @param sessionProvider 外部ツールのセッションプロバイダです
     * @return 吸収モデルです
     */
    @Bean
    @ConditionalOnProperty(prefix = "spectral.absorption", name = "enabled", havingValue = "true")
    public AbsorptionModel absorptionModel(CrossSectionTableReader reader,
            FittingToolSessionProvider sessionProvider) {
        SpectralProperties.Absorption a = p.getAbsorption();
        switch (a.getBackend()) {
            case EXTERNAL:
                return new ExternalToolAbsorptionModel(a.getModelName(), a.getColumnDensity(),
                        a.getSettings(), sessionProvider);
            case TABLE:
            default:
                return TabulatedAbsorptionModel.fromFile(Paths.get(a.getTableFile()),
                        a.getColumnDensity(), reader);
        }
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public SpectrumWriter spectrumWriter() {
        return new CsvSpectrumWriter(p.getOutput().getDir());
    }
}
