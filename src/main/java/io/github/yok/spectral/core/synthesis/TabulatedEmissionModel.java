package io.github.yok.spectral.core.synthesis;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.spectral.core.error.InvalidRangeException;
import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.model.EmissionModel;
import io.github.yok.spectral.core.model.PreparationState;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.table.ColumnarTableReader;
import io.github.yok.spectral.core.table.TableCache;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * APEC 形式のライン表・連続成分表から放射率スペクトルを合成する放射モデルです。
 *
 * <p>
 * テーブルファイルは {@code <root>/apec_v<version>_line.fits} と {@code <root>/apec_v<version>_coco.fits}
 * です。 {@link #prepare(double)} で開き、インスタンスを閉じるまで保持します。
 * </p>
 */
@Slf4j
public final class TabulatedEmissionModel implements EmissionModel, AutoCloseable {

    /**
     * 既定のテーブルバージョンです。
     */
    public static final String DEFAULT_VERSION = "2.0.2";

    /**
     * エネルギーグリッドです。
     */
    private final EnergyGrid grid;

    /**
     * 熱的広がりを適用するかどうかです。
     */
    private final boolean thermalBroadening;

    /**
     * テーブルキャッシュです。
     */
    private final TableCache tables;

    /**
     * 準備済みの合成器です（未準備の間は null）。
     */
    private SpectrumSynthesizer synthesizer;

    /**
     * 放射モデルを生成します。
     *
     * @param tableRoot テーブルファイルのディレクトリです
     * @param version テーブルのバージョン文字列（例: 2.0.2）です
     * @param grid エネルギーグリッドです（emin &gt; 0）
     * @param thermalBroadening 熱的広がりを適用するかどうかです
     * @param reader テーブルファイルのリーダです
     * @throws InvalidRangeException emin が正でない場合に発生します
     */
    public TabulatedEmissionModel(Path tableRoot, String version, EnergyGrid grid,
            boolean thermalBroadening, ColumnarTableReader reader) {
        checkNotNull(tableRoot, "tableRoot は null 不可です");
        checkNotNull(version, "version は null 不可です");
        this.grid = checkNotNull(grid, "grid は null 不可です");
        if (!(grid.emin() > 0.0)) {
            throw new InvalidRangeException("波長に変換するため emin は正である必要があります: " + grid.emin());
        }
        this.thermalBroadening = thermalBroadening;
        String prefix = "apec_v" + version;
        this.tables = new TableCache(tableRoot.resolve(prefix + "_line.fits"),
                tableRoot.resolve(prefix + "_coco.fits"), reader);
    }

    @Override
    public EnergyGrid energyGrid() {
        return grid;
    }

    /**
     * テーブルを開き、波長範囲と赤方偏移の縮小率を決めます。
     *
     * @param redshift 赤方偏移 z です
     * @throws io.github.yok.spectral.core.error.TableNotFoundException テーブルファイルが存在しない場合に発生します
     */
    @Override
    public void prepare(double redshift) {
        tables.open();
        try {
            this.synthesizer = new SpectrumSynthesizer(grid, tables, thermalBroadening, redshift);
        } catch (RuntimeException e) {
            tables.close();
            throw e;
        }
        log.info("テーブル放射モデルを準備しました。{}、z={}、熱的広がり={}、波長範囲=[{}, {}] Å", grid, redshift,
                thermalBroadening, synthesizer.getMinWavelength(), synthesizer.getMaxWavelength());
    }

    @Override
    public EmissionSpectrum getSpectrum(double kT) {
        checkState(synthesizer != null, "prepare() が呼ばれていません");
        return synthesizer.synthesize(kT);
    }

    @Override
    public PreparationState state() {
        return synthesizer != null ? PreparationState.PREPARED : PreparationState.UNPREPARED;
    }

    /**
     * 準備済みの合成器を返します。
     *
     * @return 合成器です
     * @throws IllegalStateException 未準備の場合に発生します
     */
    public SpectrumSynthesizer synthesizer() {
        checkState(synthesizer != null, "prepare() が呼ばれていません");
        return synthesizer;
    }

    /**
     * テーブルを閉じ、未準備状態に戻します。
     */
    @Override
    public void close() {
        synthesizer = null;
        tables.close();
    }
}
