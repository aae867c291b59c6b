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
package com.hellblazer.radiance.spectral.grid;

import com.hellblazer.radiance.common.Interval;
import com.hellblazer.radiance.spectral.SpectralEngineException.EmptySpectralGridException;
import com.hellblazer.radiance.spectral.response.MultiDeltaResponse;
import com.hellblazer.radiance.spectral.response.SpectralResponseFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the effective spectral grid of a measurement.
 * <p>
 * The grid starts from the caller's default grid, is replaced entirely by a medium override when one is present, and
 * is then restricted to the support of the response function:
 * <ul>
 * <li>discrete grids keep the wavelengths lying in a support interval; a multi-delta response yields exactly its
 * delta wavelengths</li>
 * <li>binned grids keep, whole, every bin whose half-open range overlaps a support interval or contains a delta</li>
 * </ul>
 * Building is pure: the same inputs always give equal grids.
 *
 * @author hal.hildebrand
 */
public final class GridBuilder {
    private static final Logger log = LoggerFactory.getLogger(GridBuilder.class);

    private GridBuilder() {
    }

    public static SpectralGrid build(SpectralGrid defaultGrid, SpectralResponseFunction srf) {
        return build(defaultGrid, Optional.empty(), srf);
    }

    /**
     * @throws EmptySpectralGridException if the response support does not meet the grid
     */
    public static SpectralGrid build(SpectralGrid defaultGrid, Optional<? extends SpectralGrid> mediumOverride,
                                     SpectralResponseFunction srf) {
        SpectralGrid grid = defaultGrid;
        if (mediumOverride.isPresent()) {
            grid = mediumOverride.get();
            log.info("Medium spectral grid overrides the default grid: {}", grid);
        }
        var support = srf.support();
        if (support.isEmpty()) {
            throw new EmptySpectralGridException("Spectral response " + srf + " has empty support");
        }

        SpectralGrid effective;
        if (grid instanceof DiscreteGrid discrete) {
            effective = restrict(discrete, srf, support);
        } else {
            effective = restrict((BinnedGrid) grid, support);
        }
        if (effective.isEmpty()) {
            throw new EmptySpectralGridException(
            "Spectral response support " + support + " does not intersect the spectral grid " + grid);
        }
        log.debug("Selected {} of {} spectral positions for support {}", effective.size(), grid.size(), support);
        return effective;
    }

    private static DiscreteGrid restrict(DiscreteGrid grid, SpectralResponseFunction srf, List<Interval> support) {
        if (srf instanceof MultiDeltaResponse deltas) {
            return new DiscreteGrid(deltas.wavelengths());
        }
        var selected = new ArrayList<Double>();
        for (double w : grid.wavelengths()) {
            for (var interval : support) {
                if (interval.contains(w)) {
                    selected.add(w);
                    break;
                }
            }
        }
        return new DiscreteGrid(selected.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private static BinnedGrid restrict(BinnedGrid grid, List<Interval> support) {
        var selected = new ArrayList<Bin>();
        for (var bin : grid.bins()) {
            for (var interval : support) {
                if (bin.overlaps(interval)) {
                    selected.add(bin);
                    break;
                }
            }
        }
        return new BinnedGrid(selected);
    }
}
