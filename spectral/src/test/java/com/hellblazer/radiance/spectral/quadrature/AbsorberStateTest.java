package com.hellblazer.radiance.spectral.quadrature;

import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class AbsorberStateTest {

    @Test
    void testLookup() {
        var state = AbsorberState.of(Map.of("pressure", 101325.0, "temperature", 288.15));
        assertEquals(288.15, state.get("temperature"));
        assertTrue(state.contains("pressure"));
        assertThrows(DomainException.class, () -> state.get("altitude"));
    }

    @Test
    void testWithIsImmutable() {
        var state = AbsorberState.empty();
        var updated = state.with("pressure", 1.0);
        assertFalse(state.contains("pressure"));
        assertEquals(1.0, updated.get("pressure"));
        assertEquals(updated, AbsorberState.of(Map.of("pressure", 1.0)));
    }

    @Test
    void testRejectsNonFinite() {
        assertThrows(IllegalArgumentException.class, () -> AbsorberState.empty().with("pressure", Double.NaN));
    }
}
