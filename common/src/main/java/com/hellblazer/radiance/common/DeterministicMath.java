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
package com.hellblazer.radiance.common;

import java.util.List;

/**
 * Deterministic floating-point reductions for spectral aggregation.
 * <p>
 * Every reduction in the spectral engine goes through a binary reduction tree so that the association of the
 * additions depends only on the number of terms, never on how the caller happened to accumulate them. Combined with a
 * canonical ordering of the terms this makes aggregate results bit-identical across runs and across permutations of
 * the input.
 * <p>
 * Usage:
 * <pre>
 * // Weighted mean of kernel results
 * double total = DeterministicMath.stableSum(weights);
 * double mean = DeterministicMath.stableDot(weights, values) / total;
 *
 * // Component-wise weighted sum of vector-valued results
 * double[] sum = DeterministicMath.stableWeightedSum(weights, vectors, 3);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class DeterministicMath {

    private DeterministicMath() {
    }

    /**
     * Stable summation using binary reduction tree.
     * <p>
     * Complexity: O(n) time, O(log n) space (recursion stack)
     *
     * @param values values to sum
     * @return sum of all values, 0 for an empty array
     */
    public static double stableSum(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return stableSumRecursive(values, 0, values.length);
    }

    /**
     * Stable summation of the half-open range {@code [start, end)}.
     *
     * @param values values
     * @param start  start index (inclusive)
     * @param end    end index (exclusive)
     * @return sum of values[start:end]
     */
    public static double stableSum(double[] values, int start, int end) {
        if (start < 0 || end > values.length || start > end) {
            throw new IllegalArgumentException(
            "Invalid range [" + start + ", " + end + ") for array of length " + values.length);
        }
        return stableSumRecursive(values, start, end);
    }

    private static double stableSumRecursive(double[] values, int start, int end) {
        int length = end - start;

        if (length == 0) {
            return 0.0;
        } else if (length == 1) {
            return values[start];
        } else {
            int mid = start + length / 2;
            return stableSumRecursive(values, start, mid) + stableSumRecursive(values, mid, end);
        }
    }

    /**
     * Stable dot product: products are formed first, then reduced with {@link #stableSum(double[])}.
     *
     * @param a first operand
     * @param b second operand, same length as {@code a}
     * @return sum of a[i] * b[i]
     */
    public static double stableDot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Length mismatch: " + a.length + " != " + b.length);
        }
        var products = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            products[i] = a[i] * b[i];
        }
        return stableSum(products);
    }

    /**
     * Stable weighted vector sum: {@code sum_i weights[i] * vectors[i]}, component-wise.
     *
     * @param weights   one weight per vector
     * @param vectors   vectors, each of length {@code dimension}
     * @param dimension number of components
     * @return weighted component-wise sum
     */
    public static double[] stableWeightedSum(double[] weights, List<double[]> vectors, int dimension) {
        if (weights.length != vectors.size()) {
            throw new IllegalArgumentException(
            "Weight count " + weights.length + " does not match vector count " + vectors.size());
        }
        var result = new double[dimension];
        var products = new double[weights.length];
        for (int c = 0; c < dimension; c++) {
            for (int i = 0; i < weights.length; i++) {
                var vector = vectors.get(i);
                if (vector.length != dimension) {
                    throw new IllegalArgumentException(
                    "Vector " + i + " has " + vector.length + " components, expected " + dimension);
                }
                products[i] = weights[i] * vector[c];
            }
            result[c] = stableSum(products);
        }
        return result;
    }
}
