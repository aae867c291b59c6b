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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Response made of unit spikes at a finite set of exact wavelengths.
 * <p>
 * Wavelengths are deduplicated and sorted. An empty set is allowed and has empty support.
 *
 * @author hal.hildebrand
 */
public final class MultiDeltaResponse implements SpectralResponseFunction {
    private final double[]       wavelengths;
    private final List<Interval> support;

    public MultiDeltaResponse(double... wavelengths) {
        for (double w : wavelengths) {
            if (!Double.isFinite(w)) {
                throw new IllegalArgumentException("Delta wavelengths must be finite, got " + w);
            }
        }
        this.wavelengths = Arrays.stream(wavelengths).sorted().distinct().toArray();
        var points = new ArrayList<Interval>(this.wavelengths.length);
        for (double w : this.wavelengths) {
            points.add(Interval.point(w));
        }
        this.support = List.copyOf(points);
    }

    public static MultiDeltaResponse of(Collection<Double> wavelengths) {
        return new MultiDeltaResponse(wavelengths.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /**
     * @return sorted, duplicate-free wavelengths
     */
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    @Override
    public List<Interval> support() {
        return support;
    }

    /**
     * @return 1 on a listed wavelength, 0 anywhere else
     */
    @Override
    public double evaluate(double wavelength) {
        return Arrays.binarySearch(wavelengths, wavelength) >= 0 ? 1.0 : 0.0;
    }

    /**
     * @return the number of deltas falling in {@code [lower, upper)}
     */
    @Override
    public double binWeight(double lower, double upper) {
        int count = 0;
        for (double w : wavelengths) {
            if (lower <= w && w < upper) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof MultiDeltaResponse that && Arrays.equals(wavelengths, that.wavelengths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(wavelengths);
    }

    @Override
    public String toString() {
        return "MultiDeltaResponse" + Arrays.toString(wavelengths);
    }
}
