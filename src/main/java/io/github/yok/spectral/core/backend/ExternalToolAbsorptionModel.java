package io.github.yok.spectral.core.backend;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.model.AbsorptionModel;
import io.github.yok.spectral.core.model.PreparationState;
import io.github.yok.spectral.core.spectrum.Spectrum;
import io.github.yok.spectral.core.spectrum.SpectrumUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 外部フィッティングツールの吸収モデル（wabs, tbabs など）を使う吸収モデルです。
 *
 * <p>
 * 吸収モデルに平坦なべき乗則（PhoIndex=0、norm=nchan/(emax-emin)）を掛けることで、 各チャネルの値がそのまま透過率になるようにします。
 * </p>
 */
@Slf4j
public final class ExternalToolAbsorptionModel implements AbsorptionModel {

    /**
     * 既定の最小エネルギー（keV）です。
     */
    public static final double DEFAULT_EMIN = 0.01;

    /**
     * 既定の最大エネルギー（keV）です。
     */
    public static final double DEFAULT_EMAX = 50.0;

    /**
     * 既定のチャネル数です。
     */
    public static final int DEFAULT_NCHAN = 100000;

    private static final String FLAT_COMPONENT = "powerlaw";

    private final String modelName;

    /**
     * 柱密度（10^22 cm^-2 単位）です。
     */
    private final double nH;

    private final EnergyGrid grid;

    private final Map<String, String> settings;

    private final FittingToolSessionProvider sessionProvider;

    private FittingToolModel model;

    /**
     * 既定のグリッド（0.01〜50 keV、100000 チャネル）で吸収モデルを生成します。
     *
     * @param modelName ツール上の吸収モデル名です
     * @param nH 柱密度（10^22 cm^-2 単位）です
     * @param settings 追加のモデル文字列です
     * @param sessionProvider セッションのプロバイダです
     */
    public ExternalToolAbsorptionModel(String modelName, double nH, Map<String, String> settings,
            FittingToolSessionProvider sessionProvider) {
        this(modelName, nH, new EnergyGrid(DEFAULT_EMIN, DEFAULT_EMAX, DEFAULT_NCHAN), settings,
                sessionProvider);
    }

    /**
     * 吸収モデルを生成します。
     *
     * @param modelName ツール上の吸収モデル名です
     * @param nH 柱密度（10^22 cm^-2 単位、0 以上）です
     * @param grid エネルギーグリッドです
     * @param settings 追加のモデル文字列です（null は空として扱います）
     * @param sessionProvider セッションのプロバイダです
     */
    public ExternalToolAbsorptionModel(String modelName, double nH, EnergyGrid grid,
            Map<String, String> settings, FittingToolSessionProvider sessionProvider) {
        this.modelName = checkNotNull(modelName, "modelName は null 不可です");
        checkArgument(nH >= 0.0 && Double.isFinite(nH), "nH は 0 以上の有限値が必要です: %s", nH);
        this.nH = nH;
        this.grid = checkNotNull(grid, "grid は null 不可です");
        this.settings = settings == null ? Map.of() : new LinkedHashMap<>(settings);
        this.sessionProvider = checkNotNull(sessionProvider, "sessionProvider は null 不可です");
    }

    @Override
    public EnergyGrid energyGrid() {
        return grid;
    }

    /**
     * ツールのセッションを開き、吸収モデル×平坦べき乗則を設定します。
     *
     * @throws io.github.yok.spectral.core.error.BackendUnavailableException ツールが利用できない場合に発生します
     */
    @Override
    public void prepare() {
        FittingToolSession session = sessionProvider.openSession();
        session.setChatter(0);
        session.setEnergies(grid.emin(), grid.emax(), grid.nchan(), "lin");
        FittingToolModel m = session.createModel(modelName + "*" + FLAT_COMPONENT);
        m.setParameter(FLAT_COMPONENT, "norm", grid.nchan() / (grid.emax() - grid.emin()));
        m.setParameter(FLAT_COMPONENT, "PhoIndex", 0.0);
        settings.forEach(session::addModelString);
        this.model = m;
        log.info("外部ツール吸収モデルを準備しました。model={}、{}、nH={}e22 cm^-2", modelName, grid, nH);
    }

    @Override
    public Spectrum getSpectrum() {
        checkState(model != null, "prepare() が呼ばれていません");
        model.setParameter(modelName, "nH", nH);
        return new Spectrum(model.values(0), SpectrumUnit.TRANSMISSION);
    }

    @Override
    public PreparationState state() {
        return model != null ? PreparationState.PREPARED : PreparationState.UNPREPARED;
    }
}
