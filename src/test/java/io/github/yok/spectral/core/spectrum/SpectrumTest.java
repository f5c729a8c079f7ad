package io.github.yok.spectral.core.spectrum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SpectrumTest {

    @Test
    @DisplayName("生成時の配列を後から書き換えてもスペクトルは変わらない")
    void valuesAreCopied() {
        double[] raw = {1.0, 2.0, 3.0};
        Spectrum s = new Spectrum(raw, SpectrumUnit.EMISSIVITY);
        raw[0] = 100.0;
        s.values()[1] = 100.0;

        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, s.values(), 0.0);
        assertEquals(6.0, s.sum(), 0.0);
        assertEquals(3, s.length());
        assertEquals("cm**3/s", s.unit().symbol());
    }

    @Test
    @DisplayName("ゼロスペクトルは isZero、1 チャネルでも非ゼロなら false")
    void zeros() {
        assertTrue(Spectrum.zeros(5, SpectrumUnit.TRANSMISSION).isZero());
        assertFalse(new Spectrum(new double[] {0.0, 1e-300}, SpectrumUnit.TRANSMISSION).isZero());
    }

    @Test
    @DisplayName("同じ単位・長さ同士は加算でき、異なる場合は IllegalArgumentException")
    void plus() {
        Spectrum a = new Spectrum(new double[] {1.0, 2.0}, SpectrumUnit.EMISSIVITY);
        Spectrum b = new Spectrum(new double[] {0.5, 0.25}, SpectrumUnit.EMISSIVITY);

        assertEquals(new Spectrum(new double[] {1.5, 2.25}, SpectrumUnit.EMISSIVITY), a.plus(b));
        assertThrows(IllegalArgumentException.class,
                () -> a.plus(new Spectrum(new double[] {1.0, 2.0}, SpectrumUnit.TRANSMISSION)));
        assertThrows(IllegalArgumentException.class,
                () -> a.plus(Spectrum.zeros(3, SpectrumUnit.EMISSIVITY)));
    }

    @Test
    @DisplayName("範囲外チャネルの参照は IndexOutOfBoundsException")
    void getOutOfRange() {
        Spectrum s = Spectrum.zeros(2, SpectrumUnit.EMISSIVITY);
        assertThrows(IndexOutOfBoundsException.class, () -> s.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> s.get(-1));
    }

    @Test
    @DisplayName("放射スペクトルの total は trace と metal の和")
    void emissionTotal() {
        EmissionSpectrum e = new EmissionSpectrum(
                new Spectrum(new double[] {1.0, 0.0}, SpectrumUnit.EMISSIVITY),
                new Spectrum(new double[] {0.5, 2.0}, SpectrumUnit.EMISSIVITY));

        assertArrayEquals(new double[] {1.5, 2.0}, e.total().values(), 0.0);
        assertNotEquals(e, EmissionSpectrum.zeros(2));
        assertEquals(EmissionSpectrum.zeros(2), EmissionSpectrum.zeros(2));
    }
}
