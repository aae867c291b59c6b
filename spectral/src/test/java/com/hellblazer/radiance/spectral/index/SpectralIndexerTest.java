package com.hellblazer.radiance.spectral.index;

import com.hellblazer.radiance.spectral.grid.Bin;
import com.hellblazer.radiance.spectral.grid.BinnedGrid;
import com.hellblazer.radiance.spectral.grid.DiscreteGrid;
import com.hellblazer.radiance.spectral.quadrature.AbsorberState;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.quadrature.QuadratureResolver;
import com.hellblazer.radiance.spectral.quadrature.QuadratureTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * @author hal.hildebrand
 */
class SpectralIndexerTest {

    @Test
    void testDiscreteGridEnumeratesWavelengths() {
        var plan = new SpectralIndexer().enumerate(DiscreteGrid.of(560, 540, 550), QuadraturePolicy.fixed(8),
                                                   AbsorberState.empty());
        assertFalse(plan.isBinned());
        assertEquals(List.of(new SpectralIndex.Monochromatic(540), new SpectralIndex.Monochromatic(550),
                             new SpectralIndex.Monochromatic(560)), plan.indices());
        assertTrue(plan.quadratures().isEmpty());
    }

    @Test
    void testBinnedGridEnumeratesNodes() {
        var table = QuadratureTable.builder("550-560").withMaxNodes(16).withErrorCurve((n, s) -> 1.0 / n).build();
        var grid = BinnedGrid.arange(540, 560, 10).withQuadratureTables(List.of(table));
        var resolver = spy(new QuadratureResolver());
        var plan = new SpectralIndexer(resolver).enumerate(grid, QuadraturePolicy.threshold(0.25),
                                                           AbsorberState.empty());
        verify(resolver, times(2)).resolve(any(Bin.class), any(), any());

        assertTrue(plan.isBinned());
        // first bin has no table: fallback to one node; second bin needs four
        assertEquals(1, plan.quadrature("540-550").orElseThrow().size());
        assertEquals(4, plan.quadrature("550-560").orElseThrow().size());
        assertEquals(5, plan.size());
        for (int i = 1; i < plan.size(); i++) {
            assertTrue(plan.indices().get(i - 1).compareTo(plan.indices().get(i)) < 0);
        }
        double weights = plan.indices()
                             .stream()
                             .filter(i -> i.binId().equals("550-560"))
                             .mapToDouble(i -> ((SpectralIndex.CorrelatedK) i).weight())
                             .sum();
        assertEquals(1.0, weights, 1e-9);
        assertFalse(plan.hasWarnings());
    }
}
