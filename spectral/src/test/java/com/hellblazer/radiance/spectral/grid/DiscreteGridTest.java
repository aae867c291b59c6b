package com.hellblazer.radiance.spectral.grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class DiscreteGridTest {

    @Test
    void testArangeIncludesStop() {
        var grid = DiscreteGrid.arange(500, 600, 5);
        assertEquals(21, grid.size());
        assertEquals(500, grid.wavelength(0));
        assertEquals(600, grid.wavelength(20));
    }

    @Test
    void testArangeStopsBeforeIncompleteStep() {
        var grid = DiscreteGrid.arange(500, 612, 5);
        assertEquals(610, grid.wavelength(grid.size() - 1));
    }

    @Test
    void testStrictlyIncreasing() {
        assertThrows(IllegalArgumentException.class, () -> new DiscreteGrid(500, 500));
        assertThrows(IllegalArgumentException.class, () -> new DiscreteGrid(510, 500));
        var grid = DiscreteGrid.of(510, 500, 510, 505);
        assertArrayEquals(new double[] { 500, 505, 510 }, grid.wavelengths());
    }

    @Test
    void testEmptyGrid() {
        assertTrue(new DiscreteGrid().isEmpty());
    }

    @Test
    void testInvalidArange() {
        assertThrows(IllegalArgumentException.class, () -> DiscreteGrid.arange(500, 600, 0));
        assertThrows(IllegalArgumentException.class, () -> DiscreteGrid.arange(600, 500, 5));
    }
}
