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
import com.hellblazer.radiance.spectral.grid.DiscreteGrid;
import com.hellblazer.radiance.spectral.grid.SpectralGrid;
import com.hellblazer.radiance.spectral.quadrature.AbsorberState;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.quadrature.QuadratureResolver;
import com.hellblazer.radiance.spectral.quadrature.QuadratureSaturationWarning;
import com.hellblazer.radiance.spectral.quadrature.ResolvedQuadrature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates the spectral indices of a grid: one monochromatic index per wavelength, or one correlated-k index per
 * quadrature node of every bin.
 *
 * @author hal.hildebrand
 */
public class SpectralIndexer {
    private static final Logger log = LoggerFactory.getLogger(SpectralIndexer.class);

    private final QuadratureResolver resolver;

    public SpectralIndexer() {
        this(new QuadratureResolver());
    }

    public SpectralIndexer(QuadratureResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param policy quadrature policy for binned grids, ignored for discrete grids
     * @param state  absorber state the error curves are evaluated at
     */
    public SpectralPlan enumerate(SpectralGrid grid, QuadraturePolicy policy, AbsorberState state) {
        var indices = new ArrayList<SpectralIndex>();
        Map<String, ResolvedQuadrature> quadratures = new LinkedHashMap<>();
        List<QuadratureSaturationWarning> warnings = new ArrayList<>();
        if (grid instanceof DiscreteGrid discrete) {
            for (double w : discrete.wavelengths()) {
                indices.add(new SpectralIndex.Monochromatic(w));
            }
        } else {
            for (var bin : ((BinnedGrid) grid).bins()) {
                var quadrature = resolver.resolve(bin, policy, state);
                quadratures.put(bin.id(), quadrature);
                quadrature.saturation().ifPresent(warnings::add);
                for (var node : quadrature.nodes()) {
                    indices.add(new SpectralIndex.CorrelatedK(bin.id(), bin.lower(), bin.upper(), node.index(), node.g(),
                                                              node.weight()));
                }
            }
        }
        indices.sort(null);
        log.debug("Enumerated {} spectral indices over {} grid positions, {} saturation warnings", indices.size(),
                  grid.size(), warnings.size());
        return new SpectralPlan(grid, indices, quadratures, warnings);
    }
}
