package io.github.yok.spectral.core.table;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContinuumTableTest {

    @Test
    @DisplayName("元素ごとに rmJ=0 の最初の行を採用し、配列は有効点数で切り詰める")
    void firstGroundStateRowPerElement() {
        InMemoryColumnarTable.Block block = new InMemoryColumnarTable.Block()
                .column("Z", new int[] {1, 1, 1, 8})
                .column("rmJ", new int[] {2, 0, 0, 0})
                .column("N_Cont", new int[] {2, 2, 1, 3})
                .column("E_Cont", new double[][] {{7, 7, 7}, {1, 2, 9}, {5, 9, 9}, {1, 2, 3}})
                .column("Continuum", new double[][] {{7, 7, 7}, {10, 20, 9}, {5, 9, 9},
                        {4, 5, 6}})
                .column("N_Pseudo", new int[] {1, 1, 1, 0})
                .column("E_Pseudo", new double[][] {{7, 7, 7}, {1.5, 9, 9}, {5, 9, 9},
                        {9, 9, 9}})
                .column("Pseudo", new double[][] {{7, 7, 7}, {0.5, 9, 9}, {5, 9, 9}, {9, 9, 9}});

        ContinuumTable table = ContinuumTable.from(block);

        ContinuumRecord h = table.find(1).orElseThrow();
        assertEquals(1, h.getElement());
        assertArrayEquals(new double[] {1, 2}, h.getContinuumEnergies(), 0.0);
        assertArrayEquals(new double[] {10, 20}, h.getContinuum(), 0.0);
        assertArrayEquals(new double[] {1.5}, h.getPseudoEnergies(), 0.0);
        assertArrayEquals(new double[] {0.5}, h.getPseudo(), 0.0);

        ContinuumRecord o = table.find(8).orElseThrow();
        assertArrayEquals(new double[] {4, 5, 6}, o.getContinuum(), 0.0);
        assertEquals(0, o.getPseudo().length);

        assertFalse(table.find(26).isPresent());
        assertTrue(table.find(8).isPresent());
    }
}
