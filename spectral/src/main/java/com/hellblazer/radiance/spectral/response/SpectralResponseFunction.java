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
package com.hellblazer.radiance.spectral.response;

import com.hellblazer.radiance.common.Interval;

import java.util.List;

/**
 * Spectral response function (SRF) of an instrument or synthetic filter, as a function of wavelength in nanometres.
 * <p>
 * Three variants exist:
 * <ul>
 * <li>{@link UniformResponse} - constant weight over a closed interval</li>
 * <li>{@link BandResponse} - tabulated, piecewise-linear weights</li>
 * <li>{@link MultiDeltaResponse} - a finite set of exact wavelengths</li>
 * </ul>
 * All weights are non-negative. The function is zero outside {@link #support()}.
 *
 * @author hal.hildebrand
 */
public sealed interface SpectralResponseFunction permits UniformResponse, BandResponse, MultiDeltaResponse {

    /**
     * @return sorted, non-overlapping closed intervals outside which the response is zero. Multi-delta responses
     * report one degenerate interval per wavelength. May be empty.
     */
    List<Interval> support();

    /**
     * Evaluate the response at a wavelength.
     *
     * @throws com.hellblazer.radiance.spectral.SpectralEngineException.DomainException if the wavelength lies outside
     *                                                                                  the support of a uniform or
     *                                                                                  band response
     */
    double evaluate(double wavelength);

    /**
     * Representative weight of the response over the spectral bin {@code [lower, upper)}.
     */
    double binWeight(double lower, double upper);

    default boolean hasEmptySupport() {
        return support().isEmpty();
    }

    /**
     * @return true if {@code wavelength} lies in one of the support intervals
     */
    default boolean supports(double wavelength) {
        for (var interval : support()) {
            if (interval.contains(wavelength)) {
                return true;
            }
        }
        return false;
    }
}
