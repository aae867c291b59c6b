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
import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;

import java.util.List;

/**
 * Constant response over the closed interval {@code [lower, upper]}.
 *
 * @param lower lower wavelength bound (nm)
 * @param upper upper wavelength bound (nm), strictly greater than {@code lower}
 * @param value positive response value
 * @author hal.hildebrand
 */
public record UniformResponse(double lower, double upper, double value) implements SpectralResponseFunction {

    public UniformResponse {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Uniform response bounds must be finite");
        }
        if (!(upper > lower)) {
            throw new IllegalArgumentException(
            "Uniform response upper bound " + upper + " must exceed lower bound " + lower);
        }
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException("Uniform response value must be positive and finite, got " + value);
        }
    }

    public UniformResponse(double lower, double upper) {
        this(lower, upper, 1.0);
    }

    @Override
    public List<Interval> support() {
        return List.of(Interval.of(lower, upper));
    }

    @Override
    public double evaluate(double wavelength) {
        if (wavelength < lower || wavelength > upper) {
            throw new DomainException(
            "Wavelength " + wavelength + " nm outside uniform response support [" + lower + ", " + upper + "]");
        }
        return value;
    }

    @Override
    public double binWeight(double lower, double upper) {
        return value;
    }
}
