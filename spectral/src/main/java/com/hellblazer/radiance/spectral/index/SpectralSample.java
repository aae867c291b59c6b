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

import java.util.Arrays;

/**
 * Reduced value of one wavelength or one bin.
 *
 * @param wavelength representative wavelength (nm)
 * @param lower      lower bound, equal to {@code wavelength} for monochromatic samples
 * @param upper      upper bound, equal to {@code wavelength} for monochromatic samples
 * @param srfWeight  response weight before normalization
 * @param value      value reduced over the quadrature nodes of a bin, or the kernel value of a wavelength
 * @author hal.hildebrand
 */
public record SpectralSample(double wavelength, double lower, double upper, double srfWeight, double[] value) {

    public SpectralSample {
        value = value.clone();
    }

    @Override
    public double[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof SpectralSample that && Double.compare(wavelength, that.wavelength) == 0
        && Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0
        && Double.compare(srfWeight, that.srfWeight) == 0 && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(wavelength);
        result = 31 * result + Double.hashCode(lower);
        result = 31 * result + Double.hashCode(upper);
        result = 31 * result + Double.hashCode(srfWeight);
        return 31 * result + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "SpectralSample{" + wavelength + " nm, w=" + srfWeight + ", " + Arrays.toString(value) + "}";
    }
}
