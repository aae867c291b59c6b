/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Radiance.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.radiance.spectral.config;

import com.hellblazer.radiance.common.quadrature.QuadratureType;
import com.hellblazer.radiance.spectral.grid.BinnedGrid;
import com.hellblazer.radiance.spectral.grid.DiscreteGrid;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.response.BandResponse;
import com.hellblazer.radiance.spectral.response.MultiDeltaResponse;
import com.hellblazer.radiance.spectral.response.UniformResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MeasurementSpecLoaderTest {

    private MeasurementSpecLoader loader;

    @BeforeEach
    void setUp() {
        loader = new MeasurementSpecLoader();
    }

    @Test
    @DisplayName("Uniform response on a regular discrete grid")
    void testUniformDiscrete() throws IOException {
        var specs = loader.loadResource("/measurements/uniform-discrete.json");
        assertEquals(1, specs.size());
        var spec = specs.get(0);
        assertEquals("green", spec.id());
        assertEquals(new UniformResponse(538.0, 570.0, 1.0), spec.srf());
        var grid = assertInstanceOf(DiscreteGrid.class, spec.defaultGrid());
        assertEquals(21, grid.size());
        assertEquals(500.0, grid.wavelength(0));
        assertEquals(600.0, grid.wavelength(20));
        assertTrue(spec.mediumGridOverride().isEmpty());
        assertEquals(QuadraturePolicy.minError(), spec.policy());
        assertTrue(spec.state().names().isEmpty());
    }

    @Test
    @DisplayName("Band response with a medium grid, threshold quadrature and absorber state")
    void testBandBinned() throws IOException {
        var spec = loader.loadResource("/measurements/band-binned.json").get(0);
        assertEquals("red-ckd", spec.id());
        var band = assertInstanceOf(BandResponse.class, spec.srf());
        assertEquals(5, band.size());
        assertEquals(10, spec.defaultGrid().size());

        var medium = assertInstanceOf(BinnedGrid.class, spec.mediumGridOverride().orElseThrow());
        assertEquals(3, medium.size());
        assertEquals("535-545", medium.bin(0).id());
        assertEquals("555-565", medium.bin(2).id());

        assertEquals(new QuadraturePolicy.ErrorThreshold(0.01, 8), spec.policy());
        assertEquals(101325.0, spec.state().get("pressure"));
        assertEquals(288.15, spec.state().get("temperature"));
    }

    @Test
    void testMeasurementArray() throws IOException {
        var specs = loader.loadResource("/measurements/instrument.json");
        assertEquals(3, specs.size());

        var blue = specs.get(0);
        assertEquals("blue", blue.id());
        assertInstanceOf(BandResponse.class, blue.srf());
        assertEquals(5, blue.defaultGrid().size());

        var unnamed = specs.get(1);
        assertEquals("measurement-1", unnamed.id());
        var deltas = assertInstanceOf(MultiDeltaResponse.class, unnamed.srf());
        assertArrayEquals(new double[] { 545.0, 555.0 }, deltas.wavelengths());
        assertEquals(QuadraturePolicy.fixed(QuadratureType.GAUSS_LOBATTO, 3), unnamed.policy());

        var nir = specs.get(2);
        assertEquals(new UniformResponse(800.0, 900.0, 0.5), nir.srf());
        assertEquals(4, nir.defaultGrid().size());
        assertEquals(new QuadraturePolicy.MinError(1e-4, 0), nir.policy());
    }

    @Test
    void testConfiguredDefaults() throws IOException {
        var config = SpectralConfiguration.builder().withMinErrorTarget(1e-2).build();
        var spec = new MeasurementSpecLoader(config).parse("""
                                                           {
                                                             "srf": { "type": "uniform", "wmin": 540, "wmax": 560 },
                                                             "grid": { "type": "binned", "edges": [540, 550, 560] }
                                                           }
                                                           """);
        assertEquals("measurement-0", spec.id());
        assertEquals(QuadraturePolicy.minError(1e-2), spec.policy());
    }

    @Test
    void testUnknownTypes() {
        assertThrows(IllegalArgumentException.class,
                     () -> loader.loadResource("/measurements/unknown-response.json"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("""
                                                                         {
                                                                           "srf": { "type": "uniform", "wmin": 540, "wmax": 560 },
                                                                           "grid": { "type": "hexagonal" }
                                                                         }
                                                                         """));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("""
                                                                         {
                                                                           "srf": { "type": "uniform", "wmin": 540, "wmax": 560 },
                                                                           "grid": { "type": "binned", "edges": [540, 560] },
                                                                           "quadrature": { "type": "adaptive" }
                                                                         }
                                                                         """));
    }

    @Test
    void testInvalidFields() {
        // missing grid
        assertThrows(IllegalArgumentException.class,
                     () -> loader.parse("{ \"srf\": { \"type\": \"uniform\", \"wmin\": 540, \"wmax\": 560 } }"));
        // missing bound
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
        "{ \"srf\": { \"type\": \"uniform\", \"wmin\": 540 }, \"grid\": { \"type\": \"discrete\", \"wavelengths\": [550] } }"));
        // non-numeric state
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
        "{ \"srf\": { \"type\": \"multi_delta\", \"wavelengths\": [550] }, \"grid\": { \"type\": \"discrete\", \"wavelengths\": [550] }, \"state\": { \"pressure\": \"high\" } }"));
        // non-numeric wavelength
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
        "{ \"srf\": { \"type\": \"multi_delta\", \"wavelengths\": [\"green\"] }, \"grid\": { \"type\": \"discrete\", \"wavelengths\": [550] } }"));
    }

    @Test
    @DisplayName("Node counts must be integers")
    void testNodeCountsAreIntegral() throws IOException {
        var template = """
                       {
                         "srf": { "type": "uniform", "wmin": 540, "wmax": 560 },
                         "grid": { "type": "binned", "edges": [540, 550, 560] },
                         "quadrature": %s
                       }
                       """;
        assertThrows(IllegalArgumentException.class,
                     () -> loader.parse(template.formatted("{ \"type\": \"fixed\", \"nodes\": 2.5 }")));
        assertThrows(IllegalArgumentException.class,
                     () -> loader.parse(template.formatted("{ \"type\": \"fixed\", \"nodes\": \"4\" }")));
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
        template.formatted("{ \"type\": \"minimum\", \"target\": 0.01, \"max_nodes\": 8.5 }")));
        assertThrows(IllegalArgumentException.class, () -> loader.parse(
        template.formatted("{ \"type\": \"fixed\", \"nodes\": 4294967296 }")));

        var spec = loader.parse(template.formatted("{ \"type\": \"fixed\", \"nodes\": 4 }"));
        assertEquals(QuadraturePolicy.fixed(4), spec.policy());
    }

    @Test
    void testMalformedDocuments() {
        assertThrows(IOException.class, () -> loader.loadResource("/measurements/missing.json"));
        assertThrows(IOException.class, () -> loader.parse("{ \"srf\": "));
        assertThrows(IOException.class,
                     () -> loader.load(new ByteArrayInputStream("".getBytes(StandardCharsets.UTF_8))));
    }
}
