package io.github.yok.spectral.core.synthesis;

import io.github.yok.spectral.core.grid.EnergyGrid;
import io.github.yok.spectral.core.table.InMemoryColumnarTable;
import io.github.yok.spectral.core.table.InMemoryTableReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * APEC 形式のライン表・連続成分表をメモリ上に組み立てるテスト用フィクスチャです。
 *
 * <p>
 * 温度インデックス i のデータはブロック i+2 に置きます。連続成分の配列は有効点数の後ろに 999 を詰めます。
 * </p>
 */
final class ApecFixture {

    static final Path ROOT = Paths.get("/apec");

    static final String VERSION = "test";

    private final double[] temperatures;

    private final Map<Integer, List<double[]>> lines = new HashMap<>();

    private final Map<Integer, List<ContinuumRow>> continua = new HashMap<>();

    ApecFixture(double... temperatures) {
        this.temperatures = temperatures.clone();
    }

    /**
     * 温度インデックス tindex のブロックに、エネルギー energy（keV）の輝線を追加します。
     */
    ApecFixture lineAtEnergy(int tindex, int element, double energy, double amplitude) {
        return line(tindex, element, PhysicalConstants.HC_KEV_ANGSTROM / energy, amplitude);
    }

    ApecFixture line(int tindex, int element, double wavelength, double amplitude) {
        lines.computeIfAbsent(tindex, k -> new ArrayList<>())
                .add(new double[] {element, wavelength, amplitude});
        return this;
    }

    ApecFixture continuum(int tindex, int element, int rmJ, double[] eCont, double[] cont,
            double[] ePseudo, double[] pseudo) {
        continua.computeIfAbsent(tindex, k -> new ArrayList<>())
                .add(new ContinuumRow(element, rmJ, eCont, cont, ePseudo, pseudo));
        return this;
    }

    static Path lineFile() {
        return ROOT.resolve("apec_v" + VERSION + "_line.fits");
    }

    static Path cocoFile() {
        return ROOT.resolve("apec_v" + VERSION + "_coco.fits");
    }

    InMemoryTableReader reader() {
        InMemoryColumnarTable line = new InMemoryColumnarTable(lineFile());
        InMemoryColumnarTable coco = new InMemoryColumnarTable(cocoFile());
        line.put(1, new InMemoryColumnarTable.Block().column("kT", temperatures.clone()));
        coco.put(1, new InMemoryColumnarTable.Block().column("kT", temperatures.clone()));

        for (int t = 0; t < temperatures.length; t++) {
            List<double[]> rows = lines.getOrDefault(t, List.of());
            int[] element = new int[rows.size()];
            double[] lambda = new double[rows.size()];
            double[] epsilon = new double[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                element[r] = (int) rows.get(r)[0];
                lambda[r] = rows.get(r)[1];
                epsilon[r] = rows.get(r)[2];
            }
            line.put(t + 2, new InMemoryColumnarTable.Block().column("element", element)
                    .column("lambda", lambda).column("epsilon", epsilon));

            List<ContinuumRow> cr = continua.getOrDefault(t, List.of());
            int n = cr.size();
            int[] z = new int[n];
            int[] rmJ = new int[n];
            int[] nCont = new int[n];
            int[] nPseudo = new int[n];
            double[][] eCont = new double[n][];
            double[][] cont = new double[n][];
            double[][] ePseudo = new double[n][];
            double[][] pseudo = new double[n][];
            for (int r = 0; r < n; r++) {
                ContinuumRow row = cr.get(r);
                z[r] = row.element;
                rmJ[r] = row.rmJ;
                nCont[r] = row.eCont.length;
                nPseudo[r] = row.ePseudo.length;
                eCont[r] = padded(row.eCont);
                cont[r] = padded(row.cont);
                ePseudo[r] = padded(row.ePseudo);
                pseudo[r] = padded(row.pseudo);
            }
            coco.put(t + 2, new InMemoryColumnarTable.Block().column("Z", z).column("rmJ", rmJ)
                    .column("N_Cont", nCont).column("E_Cont", eCont).column("Continuum", cont)
                    .column("N_Pseudo", nPseudo).column("E_Pseudo", ePseudo)
                    .column("Pseudo", pseudo));
        }
        return new InMemoryTableReader().add(line).add(coco);
    }

    TabulatedEmissionModel model(EnergyGrid grid, boolean thermalBroadening) {
        return new TabulatedEmissionModel(ROOT, VERSION, grid, thermalBroadening, reader());
    }

    private static double[] padded(double[] values) {
        double[] out = Arrays.copyOf(values, values.length + 2);
        out[values.length] = 999.0;
        out[values.length + 1] = 999.0;
        return out;
    }

    private static final class ContinuumRow {
        final int element;
        final int rmJ;
        final double[] eCont;
        final double[] cont;
        final double[] ePseudo;
        final double[] pseudo;

        ContinuumRow(int element, int rmJ, double[] eCont, double[] cont, double[] ePseudo,
                double[] pseudo) {
            this.element = element;
            this.rmJ = rmJ;
            this.eCont = eCont;
            this.cont = cont;
            this.ePseudo = ePseudo;
            this.pseudo = pseudo;
        }
    }
}
