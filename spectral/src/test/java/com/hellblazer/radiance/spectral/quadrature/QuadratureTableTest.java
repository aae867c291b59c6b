package com.hellblazer.radiance.spectral.quadrature;

import com.hellblazer.radiance.common.quadrature.QuadratureType;
import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class QuadratureTableTest {

    @Test
    void testDefaultNodeCounts() {
        var table = QuadratureTable.builder("bin").build();
        assertEquals(1, table.minNodes());
        assertEquals(QuadratureTable.DEFAULT_MAX_NODES, table.maxNodes());

        var lobatto = QuadratureTable.builder("bin").withType(QuadratureType.GAUSS_LOBATTO).withMaxNodes(4).build();
        assertArrayEquals(new int[] { 2, 3, 4 }, lobatto.availableNodeCounts());
    }

    @Test
    void testRoundUp() {
        var table = QuadratureTable.builder("bin").withAvailableNodeCounts(8, 2, 4, 4).build();
        assertArrayEquals(new int[] { 2, 4, 8 }, table.availableNodeCounts());
        assertEquals(2, table.roundUpToAvailable(1));
        assertEquals(4, table.roundUpToAvailable(3));
        assertEquals(8, table.roundUpToAvailable(8));
        assertEquals(8, table.roundUpToAvailable(9));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> QuadratureTable.builder(" "));
        assertThrows(IllegalArgumentException.class, () -> QuadratureTable.builder("bin").withMaxNodes(0));
        assertThrows(IllegalArgumentException.class, () -> QuadratureTable.builder("bin")
                                                                          .withType(QuadratureType.GAUSS_LOBATTO)
                                                                          .withAvailableNodeCounts(1, 2)
                                                                          .build());
    }

    @Test
    void testTabulatedErrorCurveLimitsNodeCounts() {
        var curve = TabulatedErrorCurve.of(new int[] { 1, 2, 4, 8, 16, 32 },
                                           new double[] { 0.5, 0.2, 0.1, 0.04, 0.01, 0.001 });
        var table = QuadratureTable.builder("bin").withErrorCurve(curve).build();
        assertArrayEquals(new int[] { 1, 2, 4, 8, 16 }, table.availableNodeCounts());

        var lobatto = QuadratureTable.builder("bin")
                                     .withType(QuadratureType.GAUSS_LOBATTO)
                                     .withMaxNodes(8)
                                     .withErrorCurve(curve)
                                     .build();
        assertArrayEquals(new int[] { 2, 4, 8 }, lobatto.availableNodeCounts());
    }

    @Test
    void testTabulatedErrorCurveMustCoverNodeCounts() {
        var curve = TabulatedErrorCurve.of(new int[] { 1, 2, 4 }, new double[] { 0.5, 0.2, 0.1 });
        assertThrows(IllegalArgumentException.class, () -> QuadratureTable.builder("bin")
                                                                          .withAvailableNodeCounts(1, 2, 3, 4)
                                                                          .withErrorCurve(curve)
                                                                          .build());
        var high = TabulatedErrorCurve.of(new int[] { 32, 64 }, new double[] { 0.01, 0.001 });
        assertThrows(IllegalArgumentException.class,
                     () -> QuadratureTable.builder("bin").withErrorCurve(high).build());
    }

    @Test
    void testAbsorptionCoefficient() {
        var kDistribution = new TabulatedKDistribution(new double[] { 0.0, 0.5, 1.0 }, new double[] { 1.0, 2.0, 4.0 },
                                                       "number_density");
        var table = QuadratureTable.builder("bin").withKDistribution(kDistribution).build();
        var state = AbsorberState.empty().with("number_density", 2.0);
        assertEquals(6.0, table.absorptionCoefficient(0.75, state), 1e-12);
        assertThrows(DomainException.class, () -> table.absorptionCoefficient(0.75, AbsorberState.empty()));
    }

    @Test
    void testAbsorptionCoefficientWithoutDistribution() {
        var table = QuadratureTable.builder("bin").build();
        assertThrows(DomainException.class, () -> table.absorptionCoefficient(0.5, AbsorberState.empty()));
    }

    @Test
    void testGDomainIsEnforced() {
        var kDistribution = new TabulatedKDistribution(new double[] { 0.1, 0.9 }, new double[] { 1.0, 1.0 });
        assertEquals(1.0, kDistribution.absorptionCoefficient(0.5, AbsorberState.empty()));
        assertThrows(DomainException.class, () -> kDistribution.absorptionCoefficient(0.05, AbsorberState.empty()));
        assertThrows(DomainException.class, () -> kDistribution.absorptionCoefficient(0.95, AbsorberState.empty()));
        assertThrows(IllegalArgumentException.class,
                     () -> new TabulatedKDistribution(new double[] { 0.0, 1.5 }, new double[] { 1.0, 1.0 }));
    }
}
