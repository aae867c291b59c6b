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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.radiance.common.quadrature.QuadratureType;
import com.hellblazer.radiance.spectral.grid.BinnedGrid;
import com.hellblazer.radiance.spectral.grid.DiscreteGrid;
import com.hellblazer.radiance.spectral.grid.SpectralGrid;
import com.hellblazer.radiance.spectral.quadrature.AbsorberState;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.response.BandResponse;
import com.hellblazer.radiance.spectral.response.MultiDeltaResponse;
import com.hellblazer.radiance.spectral.response.SpectralResponseFunction;
import com.hellblazer.radiance.spectral.response.UniformResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads measurement descriptions from JSON.
 * <p>
 * A document holds either one measurement object or a {@code "measurements"} array of them:
 *
 * <pre>
 * {
 *   "id": "red",
 *   "srf": { "type": "band", "wavelengths": [...], "values": [...], "trim": true },
 *   "grid": { "type": "discrete", "start": 500, "stop": 600, "step": 5 },
 *   "medium_grid": { "type": "binned", "edges": [535, 545, 555] },
 *   "quadrature": { "type": "minimum", "target": 1e-3, "max_nodes": 16 },
 *   "state": { "pressure": 101325.0, "temperature": 288.15 }
 * }
 * </pre>
 * <p>
 * Response types are {@code uniform}, {@code band}, {@code gaussian} and {@code multi_delta}; grid types
 * {@code discrete} and {@code binned}; quadrature types {@code fixed}, {@code minimum} and {@code threshold}. A missing
 * quadrature section selects a minimum-error policy with the configured target.
 *
 * @author hal.hildebrand
 */
public class MeasurementSpecLoader {
    private static final Logger log = LoggerFactory.getLogger(MeasurementSpecLoader.class);

    private final SpectralConfiguration configuration;
    private final ObjectMapper          objectMapper;

    public MeasurementSpecLoader() {
        this(SpectralConfiguration.defaultConfig());
    }

    public MeasurementSpecLoader(SpectralConfiguration configuration) {
        this.configuration = configuration;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load the measurements of a classpath resource.
     *
     * @throws IOException if the resource is missing or unreadable
     */
    public List<MeasurementSpec> loadResource(String resource) throws IOException {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Measurement resource not found: " + resource);
            }
            var specs = load(is);
            log.info("Loaded {} measurements from {}", specs.size(), resource);
            return specs;
        }
    }

    /**
     * @throws IOException              on malformed JSON
     * @throws IllegalArgumentException on a well-formed document describing an invalid measurement
     */
    public List<MeasurementSpec> load(InputStream json) throws IOException {
        var root = objectMapper.readTree(json);
        if (root == null || root.isMissingNode()) {
            throw new IOException("Empty measurement document");
        }
        var specs = new ArrayList<MeasurementSpec>();
        if (root.has("measurements")) {
            int i = 0;
            for (var node : root.get("measurements")) {
                specs.add(parse(node, "measurement-" + i++));
            }
        } else {
            specs.add(parse(root, "measurement-0"));
        }
        return specs;
    }

    public MeasurementSpec parse(String json) throws IOException {
        return parse(objectMapper.readTree(json), "measurement-0");
    }

    private MeasurementSpec parse(JsonNode node, String defaultId) {
        var id = node.path("id").asText(defaultId);
        var srf = parseResponse(required(node, "srf", id), id);
        var grid = parseGrid(required(node, "grid", id), id);
        var mediumGrid = node.has("medium_grid") ? parseGrid(node.get("medium_grid"), id) : null;
        var policy = node.has("quadrature") ? parsePolicy(node.get("quadrature"), id) : QuadraturePolicy.minError(
        configuration.getMinErrorTarget());
        var state = node.has("state") ? parseState(node.get("state"), id) : AbsorberState.empty();
        log.debug("Parsed measurement '{}': {}, {}, {}", id, srf, grid, policy);
        return new MeasurementSpec(id, srf, grid, mediumGrid, policy, state);
    }

    private SpectralResponseFunction parseResponse(JsonNode node, String id) {
        var type = type(node, id);
        switch (type) {
            case "uniform": {
                double value = node.path("value").asDouble(1.0);
                return new UniformResponse(number(node, "wmin", id), number(node, "wmax", id), value);
            }
            case "band": {
                var band = new BandResponse(numbers(node, "wavelengths", id), numbers(node, "values", id));
                if (node.has("retention")) {
                    return band.trim(node.get("retention").asDouble());
                }
                return node.path("trim").asBoolean(false) ? band.trim(configuration.getRetention()) : band;
            }
            case "gaussian":
                return BandResponse.gaussian(number(node, "center", id), number(node, "fwhm", id),
                                             node.path("cutoff").asDouble(3.0), node.path("resolution").asDouble(1.0),
                                             node.path("pad").asBoolean(true));
            case "multi_delta":
                return new MultiDeltaResponse(numbers(node, "wavelengths", id));
            default:
                throw new IllegalArgumentException("Measurement '" + id + "': unknown response type '" + type + "'");
        }
    }

    private SpectralGrid parseGrid(JsonNode node, String id) {
        var type = type(node, id);
        switch (type) {
            case "discrete":
                if (node.has("wavelengths")) {
                    return DiscreteGrid.of(numbers(node, "wavelengths", id));
                }
                return DiscreteGrid.arange(number(node, "start", id), number(node, "stop", id),
                                           number(node, "step", id));
            case "binned":
                if (node.has("edges")) {
                    return BinnedGrid.fromEdges(numbers(node, "edges", id));
                }
                return BinnedGrid.arange(number(node, "start", id), number(node, "stop", id),
                                         number(node, "width", id));
            default:
                throw new IllegalArgumentException("Measurement '" + id + "': unknown grid type '" + type + "'");
        }
    }

    private QuadraturePolicy parsePolicy(JsonNode node, String id) {
        var type = type(node, id);
        int maximum = node.has("max_nodes") ? integer(node, "max_nodes", id) : 0;
        switch (type) {
            case "fixed":
                var rule = node.has("rule") ? QuadratureType.fromId(node.get("rule").asText())
                                            : QuadratureType.GAUSS_LEGENDRE;
                return QuadraturePolicy.fixed(rule, integer(node, "nodes", id));
            case "minimum":
                return new QuadraturePolicy.MinError(node.path("target").asDouble(configuration.getMinErrorTarget()),
                                                     maximum);
            case "threshold":
                return new QuadraturePolicy.ErrorThreshold(number(node, "threshold", id), maximum);
            default:
                throw new IllegalArgumentException("Measurement '" + id + "': unknown quadrature type '" + type + "'");
        }
    }

    private AbsorberState parseState(JsonNode node, String id) {
        Map<String, Double> variables = new LinkedHashMap<>();
        var names = node.fieldNames();
        while (names.hasNext()) {
            var name = names.next();
            var value = node.get(name);
            if (!value.isNumber()) {
                throw new IllegalArgumentException("Measurement '" + id + "': state variable '" + name + "' is not a number");
            }
            variables.put(name, value.asDouble());
        }
        return AbsorberState.of(variables);
    }

    private static String type(JsonNode node, String id) {
        return required(node, "type", id).asText();
    }

    private static JsonNode required(JsonNode node, String field, String id) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Measurement '" + id + "': missing field '" + field + "'");
        }
        return value;
    }

    private static double number(JsonNode node, String field, String id) {
        var value = required(node, field, id);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("Measurement '" + id + "': field '" + field + "' is not a number");
        }
        return value.asDouble();
    }

    private static int integer(JsonNode node, String field, String id) {
        var value = required(node, field, id);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Measurement '" + id + "': field '" + field + "' is not an integer");
        }
        return value.intValue();
    }

    private static double[] numbers(JsonNode node, String field, String id) {
        var value = required(node, field, id);
        if (!value.isArray()) {
            throw new IllegalArgumentException("Measurement '" + id + "': field '" + field + "' is not an array");
        }
        var result = new double[value.size()];
        for (int i = 0; i < result.length; i++) {
            if (!value.get(i).isNumber()) {
                throw new IllegalArgumentException(
                "Measurement '" + id + "': element " + i + " of '" + field + "' is not a number");
            }
            result[i] = value.get(i).asDouble();
        }
        return result;
    }
}
