package io.github.yok.spectral.core.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.spectrum.Spectrum;
import io.github.yok.spectral.core.spectrum.SpectrumUnit;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExternalToolAbsorptionModelTest {

    @Test
    @DisplayName("既定グリッドは 0.01〜50 keV の 100000 チャネル")
    void defaultGrid() {
        ExternalToolAbsorptionModel model = new ExternalToolAbsorptionModel("wabs", 0.1, Map.of(),
                new RecordingFittingTool()::openSession);

        EnergyGrid g = model.energyGrid();
        assertEquals(0.01, g.emin(), 0.0);
        assertEquals(50.0, g.emax(), 0.0);
        assertEquals(100000, g.nchan());
    }

    @Test
    @DisplayName("吸収モデルに平坦なべき乗則を掛け、nH を設定した評価値を透過率として返す")
    void flatPowerLawTimesAbsorber() {
        RecordingFittingTool tool = new RecordingFittingTool();
        tool.evaluator = p -> Math.exp(-p.getOrDefault("wabs.nH", 0.0));
        EnergyGrid grid = new EnergyGrid(0.1, 10.1, 5);
        ExternalToolAbsorptionModel model = new ExternalToolAbsorptionModel("wabs", 0.5, grid,
                Map.of(), tool::openSession);

        model.prepare();
        Spectrum t = model.getSpectrum();

        assertTrue(tool.calls.contains("model=wabs*powerlaw"));
        assertEquals(0.5, tool.parameters.get("powerlaw.norm"), 1e-15);
        assertEquals(0.0, tool.parameters.get("powerlaw.PhoIndex"), 0.0);
        assertEquals(0.5, tool.parameters.get("wabs.nH"), 0.0);
        assertEquals(SpectrumUnit.TRANSMISSION, t.unit());
        assertEquals(5, t.length());
        assertEquals(Math.exp(-0.5), t.get(3), 1e-15);
    }

    @Test
    @DisplayName("負の nH は拒否する")
    void negativeColumnDensity() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalToolAbsorptionModel("wabs",
                -1.0, Map.of(), new RecordingFittingTool()::openSession));
    }
}
