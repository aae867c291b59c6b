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

import java.util.Arrays;

/**
 * Strictly increasing, duplicate-free list of wavelengths (nm).
 *
 * @author hal.hildebrand
 */
public final class DiscreteGrid implements SpectralGrid {
    private final double[] wavelengths;

    public DiscreteGrid(double... wavelengths) {
        for (int i = 0; i < wavelengths.length; i++) {
            if (!Double.isFinite(wavelengths[i])) {
                throw new IllegalArgumentException("Grid wavelengths must be finite, got " + wavelengths[i]);
            }
            if (i > 0 && !(wavelengths[i] > wavelengths[i - 1])) {
                throw new IllegalArgumentException(
                "Grid wavelengths must be strictly increasing: " + wavelengths[i - 1] + " >= " + wavelengths[i]);
            }
        }
        this.wavelengths = wavelengths.clone();
    }

    /**
     * Grid from wavelengths in any order; duplicates are removed.
     */
    public static DiscreteGrid of(double... wavelengths) {
        return new DiscreteGrid(Arrays.stream(wavelengths).sorted().distinct().toArray());
    }

    /**
     * Regular grid {@code start, start + step, ...}, including {@code stop} when it lies within a tenth of a step of
     * a grid point.
     */
    public static DiscreteGrid arange(double start, double stop, double step) {
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("Step must be positive, got " + step);
        }
        if (stop < start) {
            throw new IllegalArgumentException("Stop " + stop + " precedes start " + start);
        }
        int n = (int) Math.floor((stop - start) / step + 0.1) + 1;
        var wavelengths = new double[n];
        for (int i = 0; i < n; i++) {
            wavelengths[i] = start + i * step;
        }
        return new DiscreteGrid(wavelengths);
    }

    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public double wavelength(int i) {
        return wavelengths[i];
    }

    @Override
    public int size() {
        return wavelengths.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof DiscreteGrid that && Arrays.equals(wavelengths, that.wavelengths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(wavelengths);
    }

    @Override
    public String toString() {
        return "DiscreteGrid" + Arrays.toString(wavelengths);
    }
}
