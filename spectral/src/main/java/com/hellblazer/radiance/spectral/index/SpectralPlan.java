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
package com.hellblazer.radiance.spectral.index;

import com.hellblazer.radiance.spectral.grid.BinnedGrid;
import com.hellblazer.radiance.spectral.grid.SpectralGrid;
import com.hellblazer.radiance.spectral.quadrature.QuadratureSaturationWarning;
import com.hellblazer.radiance.spectral.quadrature.ResolvedQuadrature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the kernel needs to evaluate a measurement: the effective grid, the spectral indices in canonical order,
 * the quadrature resolved for each bin and the saturation warnings raised while resolving.
 *
 * @author hal.hildebrand
 */
public record SpectralPlan(SpectralGrid grid, List<SpectralIndex> indices, Map<String, ResolvedQuadrature> quadratures,
                           List<QuadratureSaturationWarning> warnings) {

    public SpectralPlan {
        indices = List.copyOf(indices);
        quadratures = Collections.unmodifiableMap(new LinkedHashMap<>(quadratures));
        warnings = List.copyOf(warnings);
    }

    public int size() {
        return indices.size();
    }

    public boolean isBinned() {
        return grid instanceof BinnedGrid;
    }

    public Optional<ResolvedQuadrature> quadrature(String binId) {
        return Optional.ofNullable(quadratures.get(binId));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
