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

import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.Arrays;

/**
 * Error curve tabulated by node count, optionally along one state variable with linear interpolation between the
 * tabulated states.
 *
 * @author hal.hildebrand
 */
public final class TabulatedErrorCurve implements TransmittanceErrorCurve {
    private final int[]                      nodeCounts;
    private final String                     variable;
    private final double[]                   stateValues;
    private final double[][]                 errors;
    private final PolynomialSplineFunction[] interpolants;

    private TabulatedErrorCurve(int[] nodeCounts, String variable, double[] stateValues, double[][] errors) {
        if (nodeCounts.length == 0) {
            throw new IllegalArgumentException("Error curve needs at least one node count");
        }
        for (int i = 0; i < nodeCounts.length; i++) {
            if (nodeCounts[i] < 1 || (i > 0 && nodeCounts[i] <= nodeCounts[i - 1])) {
                throw new IllegalArgumentException(
                "Node counts must be positive and strictly increasing: " + Arrays.toString(nodeCounts));
            }
        }
        if (errors.length != stateValues.length) {
            throw new IllegalArgumentException(
            "Expected one error row per state value, got " + errors.length + " rows for " + stateValues.length
            + " states");
        }
        for (var row : errors) {
            if (row.length != nodeCounts.length) {
                throw new IllegalArgumentException(
                "Error rows must have one entry per node count (" + nodeCounts.length + "), got " + row.length);
            }
            for (double e : row) {
                if (!(e >= 0.0) || !Double.isFinite(e)) {
                    throw new IllegalArgumentException("Errors must be non-negative and finite, got " + e);
                }
            }
        }
        this.nodeCounts = nodeCounts.clone();
        this.variable = variable;
        this.stateValues = stateValues.clone();
        this.errors = new double[errors.length][];
        for (int i = 0; i < errors.length; i++) {
            this.errors[i] = errors[i].clone();
        }
        if (variable == null) {
            this.interpolants = null;
        } else {
            this.interpolants = new PolynomialSplineFunction[nodeCounts.length];
            var interpolator = new LinearInterpolator();
            for (int j = 0; j < nodeCounts.length; j++) {
                var column = new double[stateValues.length];
                for (int i = 0; i < stateValues.length; i++) {
                    column[i] = errors[i][j];
                }
                interpolants[j] = interpolator.interpolate(this.stateValues, column);
            }
        }
    }

    /**
     * State-independent curve.
     */
    public static TabulatedErrorCurve of(int[] nodeCounts, double[] errors) {
        return new TabulatedErrorCurve(nodeCounts, null, new double[] { Double.NaN }, new double[][] { errors });
    }

    /**
     * Curve tabulated along {@code variable}.
     *
     * @param stateValues strictly increasing values of the state variable, at least two
     * @param errors      {@code errors[state][count]}
     */
    public static TabulatedErrorCurve alongState(String variable, double[] stateValues, int[] nodeCounts,
                                                 double[][] errors) {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("State variable name must not be blank");
        }
        if (stateValues.length < 2) {
            throw new IllegalArgumentException("A state-dependent error curve needs at least two states");
        }
        return new TabulatedErrorCurve(nodeCounts, variable, stateValues, errors);
    }

    public int[] nodeCounts() {
        return nodeCounts.clone();
    }

    @Override
    public double error(int nodes, AbsorberState state) {
        int column = Arrays.binarySearch(nodeCounts, nodes);
        if (column < 0) {
            throw new DomainException("No error data for " + nodes + " nodes, tabulated: " + Arrays.toString(nodeCounts));
        }
        if (variable == null) {
            return errors[0][column];
        }
        double x = state.get(variable);
        if (x < stateValues[0] || x > stateValues[stateValues.length - 1]) {
            throw new DomainException(
            "State variable '" + variable + "' = " + x + " outside tabulated range [" + stateValues[0] + ", "
            + stateValues[stateValues.length - 1] + "]");
        }
        return interpolants[column].value(x);
    }
}
