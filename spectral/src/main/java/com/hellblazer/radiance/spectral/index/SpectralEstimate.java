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

import com.hellblazer.radiance.spectral.quadrature.QuadratureSaturationWarning;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a measurement.
 *
 * @param value           aggregated value, one component per kernel result component
 * @param samples         reduced value per wavelength or per bin, in canonical order
 * @param realizedWeights final weight of each surviving index; the weights sum to 1
 * @param dropped         number of indices dropped under {@link FailurePolicy#BEST_EFFORT}
 * @param warnings        quadrature saturation warnings of the plan
 * @author hal.hildebrand
 */
public record SpectralEstimate(double[] value, List<SpectralSample> samples, Map<SpectralIndex, Double> realizedWeights,
                               int dropped, List<QuadratureSaturationWarning> warnings) {

    public SpectralEstimate {
        value = value.clone();
        samples = List.copyOf(samples);
        realizedWeights = Collections.unmodifiableMap(new LinkedHashMap<>(realizedWeights));
        warnings = List.copyOf(warnings);
    }

    @Override
    public double[] value() {
        return value.clone();
    }

    public int dimension() {
        return value.length;
    }

    /**
     * @throws IllegalStateException if the estimate is not scalar
     */
    public double scalar() {
        if (value.length != 1) {
            throw new IllegalStateException("Estimate has " + value.length + " components");
        }
        return value[0];
    }

    /**
     * @return true if indices were dropped or a quadrature saturated
     */
    public boolean isDegraded() {
        return dropped > 0 || !warnings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof SpectralEstimate that && Arrays.equals(value, that.value) && samples.equals(that.samples)
        && realizedWeights.equals(that.realizedWeights) && dropped == that.dropped && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(value);
        result = 31 * result + samples.hashCode();
        result = 31 * result + realizedWeights.hashCode();
        result = 31 * result + dropped;
        return 31 * result + warnings.hashCode();
    }

    @Override
    public String toString() {
        return "SpectralEstimate{" + Arrays.toString(value) + ", " + samples.size() + " samples, dropped=" + dropped
        + ", warnings=" + warnings.size() + "}";
    }
}
