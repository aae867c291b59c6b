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

import com.hellblazer.radiance.spectral.grid.SpectralGrid;
import com.hellblazer.radiance.spectral.quadrature.AbsorberState;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.response.SpectralResponseFunction;

import java.util.Optional;

/**
 * One measurement: its response function, the grid it is evaluated on and how correlated-k bins are sampled.
 *
 * @param id          measurement identifier
 * @param srf         spectral response function
 * @param defaultGrid grid used when the medium supplies none
 * @param mediumGrid  grid supplied by the medium, replacing the default; null if none
 * @param policy      quadrature policy for binned grids
 * @param state       absorber state
 * @author hal.hildebrand
 */
public record MeasurementSpec(String id, SpectralResponseFunction srf, SpectralGrid defaultGrid, SpectralGrid mediumGrid,
                             QuadraturePolicy policy, AbsorberState state) {

    public MeasurementSpec {
        if (srf == null || defaultGrid == null || policy == null || state == null) {
            throw new IllegalArgumentException("Measurement '" + id + "' is missing its response, grid, policy or state");
        }
    }

    public Optional<SpectralGrid> mediumGridOverride() {
        return Optional.ofNullable(mediumGrid);
    }
}
