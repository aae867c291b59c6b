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
package com.hellblazer.radiance.spectral.dispatch;

import com.hellblazer.radiance.spectral.index.SpectralIndex;

/**
 * External evaluation kernel: computes the radiometric quantity of interest for one spectral index.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface SpectralKernel {

    /**
     * @return one or more finite values; the same number for every index of a plan
     * @throws Exception on evaluation failure, which is retried by the dispatcher
     */
    double[] evaluate(SpectralIndex index) throws Exception;
}
