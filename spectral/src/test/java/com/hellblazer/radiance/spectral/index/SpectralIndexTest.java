package com.hellblazer.radiance.spectral.index;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SpectralIndexTest {

    @Test
    void testEqualityByContent() {
        assertEquals(new SpectralIndex.Monochromatic(550), new SpectralIndex.Monochromatic(550));
        var a = new SpectralIndex.CorrelatedK("540-550", 540, 550, 1, 0.25, 0.5);
        var b = new SpectralIndex.CorrelatedK("540-550", 540, 550, 1, 0.25, 0.5);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(545.0, a.wavelength());
    }

    @Test
    void testCanonicalOrder() {
        var first = new SpectralIndex.CorrelatedK("540-550", 540, 550, 0, 0.2, 0.5);
        var second = new SpectralIndex.CorrelatedK("540-550", 540, 550, 1, 0.8, 0.5);
        var third = new SpectralIndex.CorrelatedK("550-560", 550, 560, 0, 0.5, 1.0);
        var list = new ArrayList<SpectralIndex>(List.of(third, second, first));
        list.sort(null);
        assertEquals(List.of(first, second, third), list);

        var monos = new ArrayList<SpectralIndex>(
        List.of(new SpectralIndex.Monochromatic(560), new SpectralIndex.Monochromatic(540)));
        monos.sort(null);
        assertEquals(540.0, monos.get(0).wavelength());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SpectralIndex.Monochromatic(Double.NaN));
        assertThrows(IllegalArgumentException.class,
                     () -> new SpectralIndex.CorrelatedK("b", 540, 550, 0, 1.5, 0.5));
        assertThrows(IllegalArgumentException.class,
                     () -> new SpectralIndex.CorrelatedK("b", 550, 540, 0, 0.5, 0.5));
        assertThrows(IllegalArgumentException.class,
                     () -> new SpectralIndex.CorrelatedK("b", 540, 550, -1, 0.5, 0.5));
    }

    @Test
    void testIndexResult() {
        assertEquals(IndexResult.value(1, 2), IndexResult.value(1, 2));
        assertThrows(IllegalArgumentException.class, () -> IndexResult.value());
        assertThrows(IllegalArgumentException.class, () -> IndexResult.value(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> IndexResult.failed(null));
    }
}
