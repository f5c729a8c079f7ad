package io.github.yok.spectral.core.synthesis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.EmissionSpectrum;
import io.github.yok.spectral.core.table.FitsColumnarTableReader;
import io.github.yok.spectral.core.table.FitsTables;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * nom-tam-fits で書いた実ファイルの APEC 表から合成するテストです。
 */
class FitsTableSynthesisTest {

    private static final double TOL = 1e-6;

    @TempDir
    Path dir;

    private final EnergyGrid grid = new EnergyGrid(0.5, 5.5, 50);

    @BeforeEach
    void writeTables() throws Exception {
        double[] temperatures = {1.0, 2.0};
        float hLambda = (float) (PhysicalConstants.HC_KEV_ANGSTROM / 1.05);
        float oLambda = (float) (PhysicalConstants.HC_KEV_ANGSTROM / 2.05);

        new FitsTables()
                .table("kT", temperatures)
                .table("element", new int[] {1, 8}, "lambda", new float[] {hLambda, oLambda},
                        "epsilon", new float[] {2.0f, 5.0f})
                // 1000 Å はグリッド外
                .table("element", new int[] {1}, "lambda", new float[] {1000f},
                        "epsilon", new float[] {7.0f})
                .write(dir.resolve("apec_vtest_line.fits"));

        new FitsTables()
                .table("kT", temperatures)
                .table("Z", new int[] {1}, "rmJ", new short[] {0}, "N_Cont", new int[] {2},
                        "E_Cont", new float[][] {{0f, 10f, 999f}},
                        "Continuum", new float[][] {{1f, 1f, 999f}}, "N_Pseudo", new int[] {0},
                        "E_Pseudo", new float[][] {{999f, 999f, 999f}},
                        "Pseudo", new float[][] {{999f, 999f, 999f}})
                .table("Z", new int[] {26}, "rmJ", new short[] {0}, "N_Cont", new int[] {2},
                        "E_Cont", new float[][] {{0f, 10f, 999f}},
                        "Continuum", new float[][] {{0f, 0f, 999f}}, "N_Pseudo", new int[] {0},
                        "E_Pseudo", new float[][] {{999f, 999f, 999f}},
                        "Pseudo", new float[][] {{999f, 999f, 999f}})
                .write(dir.resolve("apec_vtest_coco.fits"));
    }

    @Test
    @DisplayName("格子温度では輝線と連続成分がそれぞれ微量元素・金属に振り分けられる")
    void synthesizesFromFitsFilesAtGridTemperature() {
        try (TabulatedEmissionModel model =
                new TabulatedEmissionModel(dir, "test", grid, false, new FitsColumnarTableReader())) {
            model.prepare(0.0);
            EmissionSpectrum spec = model.getSpectrum(1.0);
            double[] trace = spec.getTrace().values();
            double[] metal = spec.getMetal().values();

            assertEquals(5, grid.channelOf(1.05));
            assertEquals(15, grid.channelOf(2.05));
            assertEquals(2.0 + 0.1, trace[5], TOL);
            assertEquals(0.1, trace[10], TOL);
            assertEquals(5.0, metal[15], TOL);
            assertEquals(0.0, metal[5], 0.0);
        }
    }

    @Test
    @DisplayName("区間内の温度ではブロック間を線形補間する")
    void blendsBetweenFitsBlocks() {
        try (TabulatedEmissionModel model =
                new TabulatedEmissionModel(dir, "test", grid, false, new FitsColumnarTableReader())) {
            model.prepare(0.0);
            EmissionSpectrum spec = model.getSpectrum(1.5);

            assertEquals(0.5 * 2.1, spec.getTrace().get(5), TOL);
            assertEquals(0.5 * 0.1, spec.getTrace().get(30), TOL);
            assertEquals(2.5, spec.getMetal().get(15), TOL);
            assertTrue(model.getSpectrum(2.0).getTrace().isZero());
        }
    }
}
