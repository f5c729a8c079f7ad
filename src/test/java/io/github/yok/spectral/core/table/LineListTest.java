package io.github.yok.spectral.core.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LineListTest {

    @Test
    @DisplayName("元素が一致し、波長が範囲の内側（端は含まない）の輝線だけを選ぶ")
    void selectByElementAndOpenWavelengthRange() {
        LineList lines = LineList.from(new InMemoryColumnarTable.Block()
                .column("element", new int[] {1, 1, 1, 1, 8})
                .column("lambda", new double[] {1.0, 2.0, 5.0, 10.0, 5.0})
                .column("epsilon", new double[] {0.1, 0.2, 0.3, 0.4, 0.5}));

        LineList h = lines.select(1, 1.0, 10.0);

        assertEquals(2, h.size());
        assertEquals(2.0, h.wavelength(0), 0.0);
        assertEquals(0.2, h.amplitude(0), 0.0);
        assertEquals(5.0, h.wavelength(1), 0.0);
        assertEquals(1, h.element(1));
        assertEquals(0, lines.select(26, 0.0, 100.0).size());
    }

    @Test
    @DisplayName("列の長さが揃っていない場合は拒否する")
    void mismatchedColumns() {
        assertThrows(IllegalArgumentException.class,
                () -> new LineList(new int[] {1}, new double[] {1.0, 2.0}, new double[] {1.0}));
    }
}
