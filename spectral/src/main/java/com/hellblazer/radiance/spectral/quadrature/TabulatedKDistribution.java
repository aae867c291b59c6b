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
import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Tabulated k-distribution: an absorption cross-section per g, interpolated linearly and optionally multiplied by a
 * number density taken from the absorber state.
 *
 * @author hal.hildebrand
 */
public final class TabulatedKDistribution implements KDistribution {
    private final double[]                 g;
    private final double[]                 k;
    private final String                   densityVariable;
    private final PolynomialSplineFunction interpolant;
    private final Interval                 domain;

    /**
     * @param g               strictly increasing coordinates in [0, 1], at least two
     * @param k               non-negative coefficients, one per coordinate
     * @param densityVariable state variable scaling the tabulated values, or null to use them as is
     */
    public TabulatedKDistribution(double[] g, double[] k, String densityVariable) {
        if (g.length != k.length || g.length < 2) {
            throw new IllegalArgumentException(
            "k-distribution needs matching g and k arrays of at least two entries, got " + g.length + " and "
            + k.length);
        }
        if (g[0] < 0.0 || g[g.length - 1] > 1.0) {
            throw new IllegalArgumentException("g coordinates must lie in [0, 1]");
        }
        for (double v : k) {
            if (!(v >= 0.0) || !Double.isFinite(v)) {
                throw new IllegalArgumentException("Absorption coefficients must be non-negative and finite, got " + v);
            }
        }
        this.g = g.clone();
        this.k = k.clone();
        this.densityVariable = densityVariable;
        // rejects non-increasing g
        this.interpolant = new LinearInterpolator().interpolate(this.g, this.k);
        this.domain = Interval.of(this.g[0], this.g[this.g.length - 1]);
    }

    public TabulatedKDistribution(double[] g, double[] k) {
        this(g, k, null);
    }

    @Override
    public Interval gDomain() {
        return domain;
    }

    @Override
    public double absorptionCoefficient(double g, AbsorberState state) {
        if (!domain.contains(g)) {
            throw new DomainException("g = " + g + " outside tabulated k-distribution domain " + domain);
        }
        double value = interpolant.value(g);
        return densityVariable == null ? value : value * state.get(densityVariable);
    }
}
