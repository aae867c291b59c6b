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

/**
 * Transmittance error committed by a quadrature rule with a given number of nodes.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface TransmittanceErrorCurve {

    /**
     * @param nodes number of quadrature nodes
     * @param state absorber state the error is evaluated at
     * @return non-negative error estimate
     * @throws com.hellblazer.radiance.spectral.SpectralEngineException.DomainException if the node count or the state
     *                                                                                  is outside the curve's data
     */
    double error(int nodes, AbsorberState state);
}
