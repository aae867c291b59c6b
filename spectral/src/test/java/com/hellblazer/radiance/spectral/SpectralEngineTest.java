package com.hellblazer.radiance.spectral;

import com.hellblazer.radiance.spectral.SpectralEngineException.EmptySpectralGridException;
import com.hellblazer.radiance.spectral.SpectralEngineException.IndexEvaluationException;
import com.hellblazer.radiance.spectral.config.MeasurementSpec;
import com.hellblazer.radiance.spectral.config.MeasurementSpecLoader;
import com.hellblazer.radiance.spectral.config.SpectralConfiguration;
import com.hellblazer.radiance.spectral.dispatch.KernelDispatcher;
import com.hellblazer.radiance.spectral.dispatch.SpectralKernel;
import com.hellblazer.radiance.spectral.grid.BinnedGrid;
import com.hellblazer.radiance.spectral.grid.DiscreteGrid;
import com.hellblazer.radiance.spectral.grid.SpectralGrid;
import com.hellblazer.radiance.spectral.index.SpectralIndex;
import com.hellblazer.radiance.spectral.index.SpectralIndexer;
import com.hellblazer.radiance.spectral.quadrature.AbsorberState;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.quadrature.QuadratureTable;
import com.hellblazer.radiance.spectral.quadrature.TabulatedErrorCurve;
import com.hellblazer.radiance.spectral.response.UniformResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * @author hal.hildebrand
 */
public class SpectralEngineTest {

    private static MeasurementSpec uniform(double lower, double upper, SpectralGrid grid, QuadraturePolicy policy) {
        return new MeasurementSpec("test", new UniformResponse(lower, upper), grid, null, policy,
                                   AbsorberState.empty());
    }

    @Test
    @DisplayName("Uniform response over a discrete grid averages the kernel")
    void testDiscreteEvaluation() {
        var spec = uniform(538, 570, DiscreteGrid.arange(500, 600, 5), QuadraturePolicy.minError());
        try (var engine = new SpectralEngine()) {
            var plan = engine.plan(spec);
            assertEquals(7, plan.size());
            assertFalse(plan.isBinned());

            var estimate = engine.evaluate(spec, index -> new double[] { index.wavelength() });
            assertEquals(555.0, estimate.scalar(), 1e-9);
            assertEquals(7, estimate.samples().size());
            assertFalse(estimate.isDegraded());
        }
    }

    @Test
    void testLoadedMeasurement() throws IOException {
        var spec = new MeasurementSpecLoader().loadResource("/measurements/uniform-discrete.json").get(0);
        try (var engine = new SpectralEngine()) {
            var estimate = engine.evaluate(spec, index -> new double[] { 2.0, index.wavelength() });
            assertEquals(2, estimate.dimension());
            assertEquals(2.0, estimate.value()[0], 1e-12);
            assertEquals(555.0, estimate.value()[1], 1e-9);
        }
    }

    @Test
    @DisplayName("Correlated-k bins with saturating quadrature tables carry warnings")
    void testBinnedEvaluationWithWarnings() {
        var grid = BinnedGrid.arange(500, 600, 10);
        var tables = List.of("540-550", "550-560")
                         .stream()
                         .map(id -> QuadratureTable.builder(id)
                                                   .withAvailableNodeCounts(1, 2, 4)
                                                   .withErrorCurve(TabulatedErrorCurve.of(new int[] { 1, 2, 4 },
                                                                                          new double[] { 0.5, 0.2,
                                                                                                         0.1 }))
                                                   .build())
                         .toList();
        var spec = uniform(540, 560, grid.withQuadratureTables(tables), QuadraturePolicy.minError());

        try (var engine = new SpectralEngine()) {
            var plan = engine.plan(spec);
            assertTrue(plan.isBinned());
            assertEquals(8, plan.size());
            assertEquals(2, plan.warnings().size());

            var estimate = engine.evaluate(spec, index -> new double[] {
            ((SpectralIndex.CorrelatedK) index).g() });
            assertEquals(0.5, estimate.scalar(), 1e-12);
            assertEquals(2, estimate.warnings().size());
            assertEquals(4, estimate.warnings().get(0).nodes());
            assertTrue(estimate.isDegraded());
        }
    }

    @Test
    void testMediumOverride() {
        var srf = new UniformResponse(540, 560);
        try (var engine = new SpectralEngine()) {
            var plan = engine.plan(DiscreteGrid.arange(500, 600, 1), Optional.of(BinnedGrid.fromEdges(540, 550, 560)),
                                   srf, QuadraturePolicy.fixed(2), AbsorberState.empty());
            assertTrue(plan.isBinned());
            assertEquals(4, plan.size());
        }
    }

    @Test
    void testFailurePolicies() {
        var spec = uniform(540, 560, DiscreteGrid.of(540, 550, 560), QuadraturePolicy.minError());
        SpectralKernel kernel = index -> {
            if (index.wavelength() == 550.0) {
                throw new IllegalStateException("renderer unavailable");
            }
            return new double[] { index.wavelength() };
        };

        try (var engine = new SpectralEngine()) {
            assertThrows(IndexEvaluationException.class, () -> engine.evaluate(spec, kernel));
        }
        try (var engine = new SpectralEngine(SpectralConfiguration.bestEffortConfig())) {
            var estimate = engine.evaluate(spec, kernel);
            assertEquals(550.0, estimate.scalar(), 1e-9);
            assertEquals(1, estimate.dropped());
            assertTrue(estimate.isDegraded());
        }
    }

    @Test
    void testParallelEvaluationMatchesSequential() {
        var spec = uniform(500, 600, DiscreteGrid.arange(400, 700, 1), QuadraturePolicy.minError());
        double sequential;
        try (var engine = new SpectralEngine()) {
            sequential = engine.evaluate(spec, index -> new double[] { Math.sin(index.wavelength()) }).scalar();
        }
        var config = SpectralConfiguration.builder().withParallelism(4).build();
        try (var engine = new SpectralEngine(config)) {
            assertEquals(sequential,
                         engine.evaluate(spec, index -> new double[] { Math.sin(index.wavelength()) }).scalar());
        }
    }

    @Test
    void testEmptyGrid() {
        var spec = uniform(700, 800, DiscreteGrid.arange(500, 600, 5), QuadraturePolicy.minError());
        try (var engine = new SpectralEngine()) {
            assertThrows(EmptySpectralGridException.class, () -> engine.plan(spec));
        }
    }

    @Test
    void testCloseReleasesDispatcher() {
        var dispatcher = mock(KernelDispatcher.class);
        var engine = new SpectralEngine(SpectralConfiguration.defaultConfig(), new SpectralIndexer(), dispatcher);
        engine.close();
        verify(dispatcher).close();
    }
}
