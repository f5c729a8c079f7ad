package io.github.yok.spectral.core.backend;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.model.EmissionModel;
import io.github.yok.spectral.core.model.PreparationState;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.spectrum.Spectrum;
import io.github.yok.spectral.core.spectrum.SpectrumUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 外部フィッティングツールの熱的放射モデル（apec, mekal, bremss など）を使う放射モデルです。
 *
 * <p>
 * 金属量パラメータを 0 にして微量元素成分を求め、1 にした値との差を金属成分とします。 どちらもモデル固有の規格化定数を掛けて cm^3/s にします。
 * </p>
 */
@Slf4j
public final class ExternalToolEmissionModel implements EmissionModel {

    /**
     * 制動放射モデル名です。
     */
    public static final String BREMSSTRAHLUNG = "bremss";

    /**
     * 制動放射モデルの規格化定数です。
     */
    static final double BREMSS_NORMALIZATION = 3.02e-15;

    /**
     * 輝線を含むモデルの規格化定数です。
     */
    static final double LINE_NORMALIZATION = 1.0e-14;

    private final String modelName;

    private final EnergyGrid grid;

    private final boolean thermalBroadening;

    /**
     * ツールに渡す追加のモデル文字列です。
     */
    private final Map<String, String> settings;

    private final FittingToolSessionProvider sessionProvider;

    private FittingToolModel model;

    private double normalization;

    /**
     * 放射モデルを生成します。
     *
     * @param modelName ツール上のモデル名です
     * @param grid エネルギーグリッドです
     * @param thermalBroadening 熱的広がりを有効にするかどうかです
     * @param settings 追加のモデル文字列です（null は空として扱います）
     * @param sessionProvider セッションのプロバイダです
     */
    public ExternalToolEmissionModel(String modelName, EnergyGrid grid, boolean thermalBroadening,
            Map<String, String> settings, FittingToolSessionProvider sessionProvider) {
        this.modelName = checkNotNull(modelName, "modelName は null 不可です");
        this.grid = checkNotNull(grid, "grid は null 不可です");
        this.thermalBroadening = thermalBroadening;
        this.settings = settings == null ? Map.of() : new LinkedHashMap<>(settings);
        this.sessionProvider = checkNotNull(sessionProvider, "sessionProvider は null 不可です");
    }

    @Override
    public EnergyGrid energyGrid() {
        return grid;
    }

    /**
     * ツールのセッションを開き、エネルギーグリッド・モデル・赤方偏移を設定します。
     *
     * @param redshift 赤方偏移 z です
     * @throws io.github.yok.spectral.core.error.BackendUnavailableException ツールが利用できない場合に発生します
     */
    @Override
    public void prepare(double redshift) {
        FittingToolSession session = sessionProvider.openSession();
        session.setChatter(0);
        session.setEnergies(grid.emin(), grid.emax(), grid.nchan(), "lin");
        FittingToolModel m = session.createModel(modelName);
        m.setParameter(modelName, "norm", 1.0);
        m.setParameter(modelName, "Redshift", redshift);
        if (thermalBroadening) {
            session.addModelString("APECTHERMAL", "yes");
        }
        settings.forEach(session::addModelString);

        this.normalization = isBremsstrahlung() ? BREMSS_NORMALIZATION : LINE_NORMALIZATION;
        this.model = m;
        log.info("外部ツール放射モデルを準備しました。model={}、{}、z={}、熱的広がり={}", modelName, grid, redshift,
                thermalBroadening);
    }

    @Override
    public EmissionSpectrum getSpectrum(double kT) {
        checkState(model != null, "prepare() が呼ばれていません");
        model.setParameter(modelName, "kT", kT);

        double[] trace;
        double[] metal;
        if (isBremsstrahlung()) {
            // 制動放射には金属量パラメータがない
            trace = model.values(0);
            metal = new double[trace.length];
        } else {
            model.setParameter(modelName, "Abundanc", 0.0);
            trace = model.values(0);
            model.setParameter(modelName, "Abundanc", 1.0);
            double[] full = model.values(0);
            metal = new double[trace.length];
            for (int i = 0; i < metal.length; i++) {
                metal[i] = full[i] - trace[i];
            }
        }
        for (int i = 0; i < trace.length; i++) {
            trace[i] *= normalization;
            metal[i] *= normalization;
        }
        return new EmissionSpectrum(new Spectrum(trace, SpectrumUnit.EMISSIVITY),
                new Spectrum(metal, SpectrumUnit.EMISSIVITY));
    }

    @Override
    public PreparationState state() {
        return model != null ? PreparationState.PREPARED : PreparationState.UNPREPARED;
    }

    private boolean isBremsstrahlung() {
        return BREMSSTRAHLUNG.equals(modelName);
    }
}
