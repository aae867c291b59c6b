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
package com.hellblazer.radiance.spectral.quadrature;

import com.hellblazer.radiance.common.Interval;

/**
 * Absorption coefficient of a spectral bin as a function of the cumulative probability coordinate g.
 *
 * @author hal.hildebrand
 */
public interface KDistribution {

    /**
     * @return the closed sub-interval of [0, 1] on which the distribution is tabulated
     */
    Interval gDomain();

    /**
     * @throws com.hellblazer.radiance.spectral.SpectralEngineException.DomainException if {@code g} lies outside
     *                                                                                  {@link #gDomain()} or the state
     *                                                                                  lacks a required variable
     */
    double absorptionCoefficient(double g, AbsorberState state);
}
